package com.ticketexchange.offer.repository;

import com.ticketexchange.common.entity.OfferView;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OfferViewRepository extends JpaRepository<OfferView, Long> {

    List<OfferView> findByOfferIdOrderByViewedAtDesc(Long offerId);
}
