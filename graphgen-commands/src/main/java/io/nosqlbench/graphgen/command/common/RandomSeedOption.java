package io.nosqlbench.graphgen.command.common;

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

import picocli.CommandLine;

import java.util.OptionalLong;

/**
 * Shared random seed option using {@link Seed} record with automatic parsing.
 */
public class RandomSeedOption {

    /**
     * Random seed specification. A null value means the generator seeds itself
     * from system entropy and the run is not reproducible.
     *
     * @param value the seed value, or null when unspecified
     */
    public record Seed(Long value) {

        /**
         * Creates a Seed with a specific value.
         */
        public Seed(long value) {
            this(Long.valueOf(value));
        }

        /**
         * Creates an unspecified Seed.
         */
        public Seed() {
            this((Long) null);
        }

        /**
         * @return the seed, if one was given
         */
        public OptionalLong asOptional() {
            return value != null ? OptionalLong.of(value) : OptionalLong.empty();
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "auto (entropy)";
        }
    }

    /**
     * Picocli type converter for {@link Seed} specifications. Accepts `_` digit separators.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }

            try {
                long seedValue = Long.parseLong(value.trim().replace("_", ""));
                return new Seed(seedValue);
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer."
                );
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for reproducible output (default: seeded from system entropy)",
        converter = SeedConverter.class
    )
    private Seed seed;

    /**
     * Gets the Seed record.
     */
    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    @Override
    public String toString() {
        return getSeedRecord().toString();
    }
}
