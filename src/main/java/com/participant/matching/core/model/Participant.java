package com.participant.matching.core.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A campaign contact to be matched against county reference data.
 * Every identity field is optional; instances are immutable for the duration of a run.
 */
public final class Participant {
    private static final Set<String> TRUE_FLAGS = Set.of("yes", "y", "true", "1");

    private final String participantId;
    private final String email;
    private final String cell;
    private final String address;
    private final String city;
    private final String zip;
    private final String firstName;
    private final String lastName;
    private final String campaign;
    private final boolean opened;
    private final boolean clicked;

    private Participant(Builder builder) {
        this.participantId = builder.participantId != null ? builder.participantId : UUID.randomUUID().toString();
        this.email = emptyToNull(builder.email);
        this.cell = emptyToNull(builder.cell);
        this.address = emptyToNull(builder.address);
        this.city = emptyToNull(builder.city);
        this.zip = emptyToNull(builder.zip);
        this.firstName = emptyToNull(builder.firstName);
        this.lastName = emptyToNull(builder.lastName);
        this.campaign = emptyToNull(builder.campaign);
        this.opened = builder.opened;
        this.clicked = builder.clicked;
    }

    public String getParticipantId() {
        return participantId;
    }

    public String getEmail() {
        return email;
    }

    public String getCell() {
        return cell;
    }

    public String getAddress() {
        return address;
    }

    public String getCity() {
        return city;
    }

    public String getZip() {
        return zip;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getCampaign() {
        return campaign;
    }

    public boolean isOpened() {
        return opened;
    }

    public boolean isClicked() {
        return clicked;
    }

    /**
     * Returns true if the participant opened or clicked a campaign message.
     */
    public boolean isEngaged() {
        return opened || clicked;
    }

    /**
     * Parses an engagement flag exported as "yes"/"no", "true"/"false" or "1"/"0".
     * Matching is case-insensitive; anything unrecognized reads as false.
     */
    public static boolean parseFlag(String raw) {
        if (raw == null) {
            return false;
        }
        return TRUE_FLAGS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    private static String emptyToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Participant that = (Participant) o;
        return Objects.equals(participantId, that.participantId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(participantId);
    }

    @Override
    public String toString() {
        return "Participant{" +
                "participantId='" + participantId + '\'' +
                ", email='" + email + '\'' +
                ", zip='" + zip + '\'' +
                ", opened=" + opened +
                ", clicked=" + clicked +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String participantId;
        private String email;
        private String cell;
        private String address;
        private String city;
        private String zip;
        private String firstName;
        private String lastName;
        private String campaign;
        private boolean opened;
        private boolean clicked;

        public Builder participantId(String participantId) {
            this.participantId = participantId;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder cell(String cell) {
            this.cell = cell;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder zip(String zip) {
            this.zip = zip;
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder campaign(String campaign) {
            this.campaign = campaign;
            return this;
        }

        public Builder opened(boolean opened) {
            this.opened = opened;
            return this;
        }

        public Builder clicked(boolean clicked) {
            this.clicked = clicked;
            return this;
        }

        public Participant build() {
            return new Participant(this);
        }
    }
}
