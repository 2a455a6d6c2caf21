package com.example.backtesting;

import com.example.backtesting.processors.BacktestProcessor;
import com.example.backtesting.runners.BacktestRunner;
import com.example.shared.enums.DirectionPolicy;
import com.example.shared.models.Settings;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class BacktestingApplicationTest {

    @Autowired
    private ApplicationContext context;
    @Autowired
    private Settings settings;

    @Test
    void testContextLoadsWithValidatedSettings() {
        assertNotNull(context.getBean(BacktestProcessor.class));
        assertTrue(context.getBeansOfType(BacktestRunner.class).isEmpty());

        assertEquals(100, settings.getMinOverlap());
        assertEquals(2.0, settings.getZEntry());
        assertEquals(DirectionPolicy.BEST, settings.getDirectionPolicy());
        assertEquals(0.00015625, settings.getCommissionRates().get("lme").doubleValue(), 1e-12);
        assertEquals(5.0, settings.getContractSizes().get("shfe").doubleValue(), 1e-12);
        assertFalse(settings.isCommissionEnabled());
    }
}
