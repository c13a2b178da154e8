package com.ticketexchange.offer.repository;

import com.ticketexchange.common.entity.SettledTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SettledTransactionRepository extends JpaRepository<SettledTransaction, Long> {

    Optional<SettledTransaction> findByBuyerOfferId(Long buyerOfferId);

    long countByBuyerOfferId(Long buyerOfferId);
}
