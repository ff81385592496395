package com.bikerental.planner.domain;

import java.util.Locale;

public class DomainModels {
    public record BicycleRecord(long id,
                                String brand,
                                BicycleType type,
                                String frameSize,
                                double price,
                                double conditionScore,
                                double popularityScore,
                                AvailabilityStatus status) {
        public BicycleRecord {
            if (!(price >= 0) || Double.isInfinite(price)) {
                throw new IllegalArgumentException("price must be a non-negative amount: " + price);
            }
            if (!inUnitRange(conditionScore)) {
                throw new IllegalArgumentException("conditionScore must be within [0,1]: " + conditionScore);
            }
            if (!inUnitRange(popularityScore)) {
                throw new IllegalArgumentException("popularityScore must be within [0,1]: " + popularityScore);
            }
            if (type == null) type = BicycleType.OTHER;
            if (status == null) status = AvailabilityStatus.OUT_OF_SERVICE;
            frameSize = FrameSizes.normalize(frameSize);
        }

        public boolean available() {
            return status == AvailabilityStatus.AVAILABLE;
        }
    }

    public enum BicycleType {
        ROAD, MOUNTAIN, HYBRID, ELECTRIC, CITY, SINGLE_GEAR, OTHER;

        /**
         * Accepts enum names as well as catalog labels such as "Mountain Bike" or "single gear".
         * Returns null for a label that names no known type.
         */
        public static BicycleType fromLabel(String label) {
            if (label == null || label.isBlank()) return null;
            String key = label.trim().toUpperCase(Locale.ROOT)
                    .replaceAll("\\s+BIKE$", "")
                    .replaceAll("[\\s-]+", "_");
            for (BicycleType t : values()) {
                if (t.name().equals(key)) return t;
            }
            return null;
        }
    }

    public enum AvailabilityStatus {
        AVAILABLE, RENTED, OUT_OF_SERVICE;

        public static AvailabilityStatus fromLabel(String label) {
            if (label == null || label.isBlank()) return null;
            String key = label.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
            return switch (key) {
                case "AVAILABLE" -> AVAILABLE;
                case "RENTED" -> RENTED;
                // "Under maintenance" and "Unavailable" are the labels the rental desk writes
                case "OUT_OF_SERVICE", "UNDER_MAINTENANCE", "UNAVAILABLE", "DAMAGED" -> OUT_OF_SERVICE;
                default -> null;
            };
        }
    }

    public static final class FrameSizes {
        private FrameSizes() {}

        /** Letter sizes are upper-cased, numeric sizes lose a trailing unit ("54cm" -> "54"). */
        public static String normalize(String frameSize) {
            if (frameSize == null || frameSize.isBlank()) return null;
            String v = frameSize.trim().toUpperCase(Locale.ROOT);
            if (v.matches("\\d+(\\.\\d+)?\\s*(CM|IN|\")")) {
                v = v.replaceAll("\\s*(CM|IN|\")$", "");
            }
            return v;
        }
    }

    private static boolean inUnitRange(double v) {
        return v >= 0.0 && v <= 1.0;
    }
}
