package com.ticketexchange.offer.repository;

import com.ticketexchange.common.entity.SellerFulfillment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SellerFulfillmentRepository extends JpaRepository<SellerFulfillment, Long> {
}
