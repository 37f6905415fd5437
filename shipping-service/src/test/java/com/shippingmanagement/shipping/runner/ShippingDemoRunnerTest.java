package com.shippingmanagement.shipping.runner;

import com.shippingmanagement.shipping.service.ShippingStrategyFactory;
import com.shippingmanagement.shipping.service.strategy.AirShippingStrategy;
import com.shippingmanagement.shipping.service.strategy.GroundShippingStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ShippingDemoRunner")
class ShippingDemoRunnerTest {

    @Test
    @DisplayName("Should print both demo sections in order")
    void printsDemo() {
        ShippingStrategyFactory factory = new ShippingStrategyFactory(
                List.of(new GroundShippingStrategy(), new AirShippingStrategy()));
        ShippingDemoRunner runner = new ShippingDemoRunner(factory);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        runner.printDemo(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertThat(buffer.toString(StandardCharsets.UTF_8).lines()).containsExactly(
                "Strategy Pattern without Factory:",
                "Ground shipping cost: 15.0",
                "Air shipping cost: 30.0",
                "",
                "Strategy Pattern with Factory:",
                "Factory-created Ground shipping cost: 15.0",
                "Factory-created Air shipping cost: 30.0");
    }
}
