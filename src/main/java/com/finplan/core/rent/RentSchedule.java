package com.finplan.core.rent;

import java.io.Serializable;

/**
 * A rent model attached to the driver that receives its projection.
 *
 * @param model           rent rule
 * @param baseYear        year the model's base figures refer to
 * @param rentDriverId    driver receiving the rent
 * @param revenueDriverId driver read for revenue share, {@code null} when the model needs no revenue
 */
public record RentSchedule(RentModel model, int baseYear, String rentDriverId, String revenueDriverId)
        implements Serializable {

    public RentSchedule {
        if (model == null || rentDriverId == null) {
            throw new IllegalArgumentException("Rent schedule needs a model and a rent driver");
        }
    }
}
