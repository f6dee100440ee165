/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.adapter.outbound.capability;

import me.golemcore.agent.domain.component.Capability;
import me.golemcore.agent.domain.exception.CapabilityValidationException;
import me.golemcore.agent.domain.model.CapabilityResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Basic arithmetic on two operands.
 *
 * <p>
 * Parameters: {@code operation} (add, subtract, multiply, divide), {@code a},
 * {@code b}. Operands may be JSON numbers or numeric strings, since the
 * key=value call syntax only produces strings.
 *
 * <p>
 * Configuration: {@code agent.capabilities.calculator.enabled}
 */
@Component
public class CalculatorCapability implements Capability {

    public static final String NAME = "calculator";

    private final boolean enabled;

    public CalculatorCapability(AgentProperties properties) {
        this.enabled = properties.getCapabilities().getCalculator().isEnabled();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Arithmetic on two numbers. Params: operation (add|subtract|multiply|divide), a, b.";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<CapabilityResult> execute(Map<String, Object> parameters) {
        try {
            return CompletableFuture.completedFuture(calculate(parameters));
        } catch (CapabilityValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CapabilityResult calculate(Map<String, Object> parameters) {
        Object rawOperation = parameters.get("operation");
        if (!(rawOperation instanceof String operation) || operation.isBlank()) {
            throw new CapabilityValidationException("Missing parameter: operation");
        }
        double a = operand(parameters, "a");
        double b = operand(parameters, "b");

        double result;
        switch (operation.trim().toLowerCase(Locale.ROOT)) {
        case "add" -> result = a + b;
        case "subtract" -> result = a - b;
        case "multiply" -> result = a * b;
        case "divide" -> {
            if (b == 0) {
                return CapabilityResult.failure("Division by zero");
            }
            result = a / b;
        }
        default -> throw new CapabilityValidationException("Unsupported operation: " + operation);
        }
        return CapabilityResult.success(normalize(result));
    }

    private double operand(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new CapabilityValidationException("Parameter " + key + " is not a number: " + text);
            }
        }
        throw new CapabilityValidationException("Missing parameter: " + key);
    }

    private static Number normalize(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
            return (long) value;
        }
        return value;
    }
}
