package com.finplan.core.rent;

import java.io.Serializable;

/**
 * @param year fiscal year
 * @param rent rent for the year
 * @param type model that produced it
 */
public record RentProjection(int year, double rent, RentModelType type) implements Serializable {}
