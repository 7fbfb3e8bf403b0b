package io.nosqlbench.dynamo.core.family;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Factory for discovering {@link FractalFamily} implementations via SPI.
 *
 * <p>Families are registered under {@code META-INF/services} (usually with
 * {@code @AutoService(FractalFamily.class)}) and looked up by their {@link FamilyName}.
 * Every lookup returns a fresh instance, so switching the active family never shares view
 * state with the previous one.
 *
 * <pre>{@code
 * FractalFamily<?> family = FamilyIO.create("mandelbrot");
 * List<String> names = FamilyIO.getAvailableNames();
 * }</pre>
 */
public final class FamilyIO {

    private static final Logger logger = LogManager.getLogger(FamilyIO.class);

    @SuppressWarnings("rawtypes")
    private static final ServiceLoader<FractalFamily> serviceLoader =
        ServiceLoader.load(FractalFamily.class);

    private FamilyIO() {
    }

    /**
     * Gets a new family instance by name.
     *
     * @param name the {@link FamilyName} value
     * @return a new instance, or empty if no provider carries that name
     */
    public static Optional<FractalFamily<?>> get(String name) {
        return providers()
            .filter(provider -> name.equals(familyName(provider.type())))
            .findFirst()
            .map(provider -> (FractalFamily<?>) provider.get());
    }

    /**
     * Creates a family by name.
     *
     * @throws IllegalArgumentException if no family with the given name exists
     */
    public static FractalFamily<?> create(String name) {
        return get(name).orElseThrow(() -> new IllegalArgumentException(
            "No family found with name: " + name + ". Available: " + getAvailableNames()));
    }

    /**
     * @return new instances of every registered family
     */
    public static List<FractalFamily<?>> getAll() {
        List<FractalFamily<?>> result = new ArrayList<>();
        providers().forEach(provider -> result.add((FractalFamily<?>) provider.get()));
        return result;
    }

    /**
     * @return names of all registered families, in discovery order
     */
    public static List<String> getAvailableNames() {
        List<String> names = providers()
            .map(provider -> familyName(provider.type()))
            .filter(n -> n != null)
            .collect(Collectors.toList());
        logger.debug("Discovered {} families: {}", names.size(), names);
        return names;
    }

    @SuppressWarnings("rawtypes")
    private static Stream<ServiceLoader.Provider<FractalFamily>> providers() {
        synchronized (serviceLoader) {
            return serviceLoader.stream().collect(Collectors.toList()).stream();
        }
    }

    private static String familyName(Class<?> type) {
        FamilyName annotation = type.getAnnotation(FamilyName.class);
        if (annotation == null) {
            logger.warn("Family provider {} has no @FamilyName and cannot be looked up by name", type.getName());
            return null;
        }
        return annotation.value();
    }
}
