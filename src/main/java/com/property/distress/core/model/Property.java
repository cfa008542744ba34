package com.property.distress.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A physical parcel, the hub every signal record and owner attaches to.
 * The parcel id is the stable external identifier; every other field may be null or stale.
 * The {@code id} is assigned by the store and increases with insertion order.
 */
public class Property {
    private final Long id;
    private final String parcelId;
    private final String address;
    private final String normalizedAddress;
    private final String city;
    private final String state;
    private final String zip;
    private final String propertyType;
    private final BigDecimal assessedMarketValue;
    private final BigDecimal taxableValue;
    private final Instant createdAt;

    private Property(Builder builder) {
        this.id = builder.id;
        this.parcelId = builder.parcelId.trim();
        this.address = builder.address;
        this.normalizedAddress = builder.normalizedAddress != null ? builder.normalizedAddress : "";
        this.city = builder.city;
        this.state = builder.state;
        this.zip = builder.zip;
        this.propertyType = builder.propertyType;
        this.assessedMarketValue = builder.assessedMarketValue;
        this.taxableValue = builder.taxableValue;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public Long getId() {
        return id;
    }

    public String getParcelId() {
        return parcelId;
    }

    public String getAddress() {
        return address;
    }

    public String getNormalizedAddress() {
        return normalizedAddress;
    }

    public String getCity() {
        return city;
    }

    public String getState() {
        return state;
    }

    public String getZip() {
        return zip;
    }

    public String getPropertyType() {
        return propertyType;
    }

    public BigDecimal getAssessedMarketValue() {
        return assessedMarketValue;
    }

    public BigDecimal getTaxableValue() {
        return taxableValue;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean hasNormalizedAddress() {
        return !normalizedAddress.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Property property = (Property) o;
        return Objects.equals(parcelId, property.parcelId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parcelId);
    }

    @Override
    public String toString() {
        return "Property{" +
                "id=" + id +
                ", parcelId='" + parcelId + '\'' +
                ", address='" + address + '\'' +
                ", city='" + city + '\'' +
                ", zip='" + zip + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Property property) {
        return new Builder()
                .id(property.id)
                .parcelId(property.parcelId)
                .address(property.address)
                .normalizedAddress(property.normalizedAddress)
                .city(property.city)
                .state(property.state)
                .zip(property.zip)
                .propertyType(property.propertyType)
                .assessedMarketValue(property.assessedMarketValue)
                .taxableValue(property.taxableValue)
                .createdAt(property.createdAt);
    }

    public static class Builder {
        private Long id;
        private String parcelId;
        private String address;
        private String normalizedAddress;
        private String city;
        private String state;
        private String zip;
        private String propertyType;
        private BigDecimal assessedMarketValue;
        private BigDecimal taxableValue;
        private Instant createdAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder parcelId(String parcelId) {
            this.parcelId = parcelId;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder normalizedAddress(String normalizedAddress) {
            this.normalizedAddress = normalizedAddress;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder zip(String zip) {
            this.zip = zip;
            return this;
        }

        public Builder propertyType(String propertyType) {
            this.propertyType = propertyType;
            return this;
        }

        public Builder assessedMarketValue(BigDecimal assessedMarketValue) {
            this.assessedMarketValue = assessedMarketValue;
            return this;
        }

        public Builder taxableValue(BigDecimal taxableValue) {
            this.taxableValue = taxableValue;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Property build() {
            Objects.requireNonNull(parcelId, "parcelId is required");
            if (parcelId.isBlank()) {
                throw new IllegalArgumentException("parcelId must not be blank");
            }
            return new Property(this);
        }
    }
}
