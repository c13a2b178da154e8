package com.ticketexchange.offer.repository;

import com.ticketexchange.common.entity.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Read-only view of the event catalogue
 */
@Repository
public interface EventRepository extends JpaRepository<Event, Long> {
}
