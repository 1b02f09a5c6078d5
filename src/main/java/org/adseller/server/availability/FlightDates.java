package org.adseller.server.availability;

import lombok.Value;

import java.time.LocalDate;

@Value(staticConstructor = "of")
public class FlightDates {

    LocalDate startDate;

    LocalDate endDate;
}
