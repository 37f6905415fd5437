package com.shippingmanagement.shipping.runner;

import com.shippingmanagement.shipping.constants.ShippingConstants;
import com.shippingmanagement.shipping.service.ShippingCostCalculator;
import com.shippingmanagement.shipping.service.ShippingStrategyFactory;
import com.shippingmanagement.shipping.service.strategy.AirShippingStrategy;
import com.shippingmanagement.shipping.service.strategy.GroundShippingStrategy;
import com.shippingmanagement.shipping.service.strategy.ShippingStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.math.BigDecimal;

/**
 * Prints shipping costs computed with directly created strategies,
 * then with strategies resolved through the factory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShippingDemoRunner implements CommandLineRunner {

    private final ShippingStrategyFactory strategyFactory;

    @Override
    public void run(String... args) {
        printDemo(System.out);
    }

    void printDemo(PrintStream out) {
        BigDecimal weight = ShippingConstants.DEMO_WEIGHT_KG;
        log.debug("Running shipping demo: weight={}", weight);

        out.println("Strategy Pattern without Factory:");

        ShippingCostCalculator calculator = new ShippingCostCalculator(new GroundShippingStrategy());
        out.println("Ground shipping cost: " + calculator.calculateCost(weight));

        calculator.setStrategy(new AirShippingStrategy());
        out.println("Air shipping cost: " + calculator.calculateCost(weight));

        out.println();
        out.println("Strategy Pattern with Factory:");

        ShippingStrategy groundStrategy = strategyFactory.createStrategy(ShippingConstants.MODE_GROUND);
        ShippingCostCalculator factoryCalculator = new ShippingCostCalculator(groundStrategy);
        out.println("Factory-created Ground shipping cost: " + factoryCalculator.calculateCost(weight));

        factoryCalculator.setStrategy(strategyFactory.createStrategy(ShippingConstants.MODE_AIR));
        out.println("Factory-created Air shipping cost: " + factoryCalculator.calculateCost(weight));
    }
}
