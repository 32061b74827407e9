package com.flightphotos.scraper.store;

import com.flightphotos.scraper.model.Flight;

import java.util.List;
import java.util.Optional;

public interface FlightStore {

    /**
     * Stores the flight unless one with the same natural key exists.
     * On insert the generated id is set on the passed flight.
     *
     * @return true if a row was inserted, false for a duplicate
     */
    boolean insertIfAbsent(Flight flight);

    Optional<Flight> findById(long id);

    /** Flights of one registration, earliest departure first */
    List<Flight> findByRegistration(String registration);

    List<Flight> findAll();

    boolean delete(long id);

    void deleteAll();
}
