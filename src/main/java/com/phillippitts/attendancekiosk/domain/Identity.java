package com.phillippitts.attendancekiosk.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Identification outcome for one face in one frame.
 *
 * <p>Either the vision provider matched the face to an enrolled person ({@link Known}),
 * or it did not ({@link Unknown}).
 */
public sealed interface Identity permits Identity.Known, Identity.Unknown {

    /**
     * Returns the matched person id, empty when the face is unknown.
     */
    Optional<String> personId();

    static Identity known(String personId) {
        return new Known(personId);
    }

    static Identity unknown() {
        return Unknown.INSTANCE;
    }

    /** Face matched to an enrolled person. */
    record Known(String id) implements Identity {
        public Known {
            Objects.requireNonNull(id, "personId must not be null");
            if (id.isBlank()) {
                throw new IllegalArgumentException("personId must not be blank");
            }
        }

        @Override
        public Optional<String> personId() {
            return Optional.of(id);
        }
    }

    /** Face not matched to anyone. */
    final class Unknown implements Identity {
        private static final Unknown INSTANCE = new Unknown();

        private Unknown() {
        }

        @Override
        public Optional<String> personId() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "Unknown";
        }
    }
}
