package com.property.distress.core.model;

import java.util.Objects;

/**
 * The live owner of a property. A property has at most one.
 */
public class Owner {
    private final Long id;
    private final Long propertyId;
    private final String ownerName;
    private final String normalizedName;
    private final String mailingAddress;
    private final String mailingCity;
    private final String mailingState;
    private final String mailingZip;
    private final AbsenteeStatus absenteeStatus;

    private Owner(Builder builder) {
        this.id = builder.id;
        this.propertyId = builder.propertyId;
        this.ownerName = builder.ownerName;
        this.normalizedName = builder.normalizedName != null ? builder.normalizedName : "";
        this.mailingAddress = builder.mailingAddress;
        this.mailingCity = builder.mailingCity;
        this.mailingState = builder.mailingState;
        this.mailingZip = builder.mailingZip;
        this.absenteeStatus = builder.absenteeStatus;
    }

    public Long getId() {
        return id;
    }

    public Long getPropertyId() {
        return propertyId;
    }

    public String getOwnerName() {
        return ownerName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getMailingAddress() {
        return mailingAddress;
    }

    public String getMailingCity() {
        return mailingCity;
    }

    public String getMailingState() {
        return mailingState;
    }

    public String getMailingZip() {
        return mailingZip;
    }

    /**
     * Null when the classification could not be determined at load time.
     */
    public AbsenteeStatus getAbsenteeStatus() {
        return absenteeStatus;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Owner owner = (Owner) o;
        return Objects.equals(propertyId, owner.propertyId)
                && Objects.equals(normalizedName, owner.normalizedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(propertyId, normalizedName);
    }

    @Override
    public String toString() {
        return "Owner{" +
                "id=" + id +
                ", propertyId=" + propertyId +
                ", ownerName='" + ownerName + '\'' +
                ", absenteeStatus=" + absenteeStatus +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Owner owner) {
        return new Builder()
                .id(owner.id)
                .propertyId(owner.propertyId)
                .ownerName(owner.ownerName)
                .normalizedName(owner.normalizedName)
                .mailingAddress(owner.mailingAddress)
                .mailingCity(owner.mailingCity)
                .mailingState(owner.mailingState)
                .mailingZip(owner.mailingZip)
                .absenteeStatus(owner.absenteeStatus);
    }

    public static class Builder {
        private Long id;
        private Long propertyId;
        private String ownerName;
        private String normalizedName;
        private String mailingAddress;
        private String mailingCity;
        private String mailingState;
        private String mailingZip;
        private AbsenteeStatus absenteeStatus;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder propertyId(Long propertyId) {
            this.propertyId = propertyId;
            return this;
        }

        public Builder ownerName(String ownerName) {
            this.ownerName = ownerName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder mailingAddress(String mailingAddress) {
            this.mailingAddress = mailingAddress;
            return this;
        }

        public Builder mailingCity(String mailingCity) {
            this.mailingCity = mailingCity;
            return this;
        }

        public Builder mailingState(String mailingState) {
            this.mailingState = mailingState;
            return this;
        }

        public Builder mailingZip(String mailingZip) {
            this.mailingZip = mailingZip;
            return this;
        }

        public Builder absenteeStatus(AbsenteeStatus absenteeStatus) {
            this.absenteeStatus = absenteeStatus;
            return this;
        }

        public Owner build() {
            Objects.requireNonNull(ownerName, "ownerName is required");
            return new Owner(this);
        }
    }
}
