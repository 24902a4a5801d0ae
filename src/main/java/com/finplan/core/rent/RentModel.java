package com.finplan.core.rent;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * A rule producing the rent of a year.
 */
public sealed interface RentModel extends Serializable
        permits RentModel.FixedEscalation, RentModel.RevenueShare, RentModel.Partner {

    RentModelType type();

    /**
     * @param year     year to price
     * @param baseYear year the model's base figures refer to
     * @param revenue  revenue of the year, when known
     */
    double rentFor(int year, int baseYear, OptionalDouble revenue);

    /** Every configuration problem, empty when valid. */
    List<String> validate();

    private static int steps(int year, int baseYear, int frequency) {
        return Math.floorDiv(year - baseYear, frequency);
    }

    /**
     * {@code baseRent × (1 + escalationRate)^floor((year − baseYear) / frequency)}.
     */
    record FixedEscalation(double baseRent, double escalationRate, int escalationFrequency) implements RentModel {

        @Override
        public RentModelType type() {
            return RentModelType.FIXED_ESCALATION;
        }

        @Override
        public double rentFor(int year, int baseYear, OptionalDouble revenue) {
            return baseRent * Math.pow(1 + escalationRate, steps(year, baseYear, escalationFrequency));
        }

        @Override
        public List<String> validate() {
            var errors = new ArrayList<String>();
            if (baseRent <= 0) {
                errors.add("Base rent must be greater than 0");
            }
            if (escalationRate < 0) {
                errors.add("Escalation rate cannot be negative");
            }
            if (escalationFrequency < 1) {
                errors.add("Escalation frequency must be at least 1 year");
            }
            return errors;
        }
    }

    /**
     * {@code revenue × revenueSharePct / 100}, raised to the minimum and capped at the maximum when set.
     */
    record RevenueShare(double revenueSharePct, Double minimumRent, Double maximumRent) implements RentModel {

        @Override
        public RentModelType type() {
            return RentModelType.REVENUE_SHARE;
        }

        @Override
        public double rentFor(int year, int baseYear, OptionalDouble revenue) {
            if (revenue.isEmpty()) {
                throw new IllegalArgumentException("Revenue is required for the revenue share model (year " + year + ")");
            }
            double rent = revenue.getAsDouble() * (revenueSharePct / 100);
            if (minimumRent != null) {
                rent = Math.max(rent, minimumRent);
            }
            if (maximumRent != null) {
                rent = Math.min(rent, maximumRent);
            }
            return rent;
        }

        @Override
        public List<String> validate() {
            var errors = new ArrayList<String>();
            if (revenueSharePct < 0 || revenueSharePct > 100) {
                errors.add("Revenue share percentage must be between 0 and 100");
            }
            if (minimumRent != null && minimumRent < 0) {
                errors.add("Minimum rent cannot be negative");
            }
            if (maximumRent != null && maximumRent < 0) {
                errors.add("Maximum rent cannot be negative");
            }
            if (minimumRent != null && maximumRent != null && minimumRent > maximumRent) {
                errors.add("Minimum rent cannot exceed maximum rent");
            }
            return errors;
        }
    }

    /**
     * Land and built-up area priced at cost, times a yield that grows every {@code growthFrequency} years.
     */
    record Partner(double landSize, double landPricePerSqm, double buaSize, double buaPricePerSqm,
                   double yieldBasePct, double yieldGrowthRate, int growthFrequency) implements RentModel {

        @Override
        public RentModelType type() {
            return RentModelType.PARTNER;
        }

        public double capexBase() {
            return landSize * landPricePerSqm + buaSize * buaPricePerSqm;
        }

        @Override
        public double rentFor(int year, int baseYear, OptionalDouble revenue) {
            double yieldPct = yieldBasePct * Math.pow(1 + yieldGrowthRate, steps(year, baseYear, growthFrequency));
            return capexBase() * (yieldPct / 100);
        }

        @Override
        public List<String> validate() {
            var errors = new ArrayList<String>();
            if (landSize <= 0) {
                errors.add("Land size must be greater than 0");
            }
            if (landPricePerSqm <= 0) {
                errors.add("Land price per sqm must be greater than 0");
            }
            if (buaSize <= 0) {
                errors.add("BUA size must be greater than 0");
            }
            if (buaPricePerSqm <= 0) {
                errors.add("BUA price per sqm must be greater than 0");
            }
            if (yieldBasePct <= 0) {
                errors.add("Yield base must be greater than 0");
            }
            if (yieldGrowthRate < 0) {
                errors.add("Yield growth rate cannot be negative");
            }
            if (growthFrequency < 1) {
                errors.add("Growth frequency must be at least 1 year");
            }
            return errors;
        }
    }
}
