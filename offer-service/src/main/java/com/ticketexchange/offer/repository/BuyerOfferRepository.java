package com.ticketexchange.offer.repository;

import com.ticketexchange.common.entity.BuyerOffer;
import com.ticketexchange.common.entity.BuyerOffer.OfferStatus;
import com.ticketexchange.common.entity.PaymentHold.HoldStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface BuyerOfferRepository extends JpaRepository<BuyerOffer, Long> {

    /**
     * Find offer with pessimistic write lock (SELECT ... FOR UPDATE), held until the
     * surrounding transaction ends. Bounded wait so a stuck holder cannot pile up callers.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    @Query("SELECT o FROM BuyerOffer o WHERE o.id = :id")
    Optional<BuyerOffer> findByIdForUpdate(@Param("id") Long id);

    /**
     * Buyer's offer history, newest first
     */
    List<BuyerOffer> findByBuyerIdOrderByCreatedAtDesc(Long buyerId);

    /**
     * Open offers for an event that sellers can still fulfil
     */
    @Query("SELECT o FROM BuyerOffer o WHERE o.eventId = :eventId " +
           "AND o.status = :status " +
           "AND o.expiresAt > :now " +
           "AND (:minPrice IS NULL OR o.maxPrice >= :minPrice)")
    List<BuyerOffer> findOpenOffersForEvent(@Param("eventId") Long eventId,
                                            @Param("status") OfferStatus status,
                                            @Param("now") LocalDateTime now,
                                            @Param("minPrice") BigDecimal minPrice,
                                            Sort sort);

    /**
     * Ids of offers past their expiry that are still in the given status, oldest expiry first
     */
    @Query("SELECT o.id FROM BuyerOffer o WHERE o.status = :status " +
           "AND o.expiresAt <= :now " +
           "ORDER BY o.expiresAt ASC")
    List<Long> findExpiredOfferIds(@Param("status") OfferStatus status,
                                   @Param("now") LocalDateTime now,
                                   Pageable pageable);

    /**
     * Matched offers whose payment was not captured: capture failed, or the hold is still
     * only authorized well after the match (process stopped between commit and capture).
     */
    @Query("SELECT o.id FROM BuyerOffer o WHERE o.status = :matched " +
           "AND (o.paymentHold.status = :captureFailed " +
           "OR (o.paymentHold.status = :authorized AND o.matchedAt <= :matchedBefore)) " +
           "ORDER BY o.matchedAt ASC")
    List<Long> findOfferIdsPendingCapture(@Param("matched") OfferStatus matched,
                                          @Param("captureFailed") HoldStatus captureFailed,
                                          @Param("authorized") HoldStatus authorized,
                                          @Param("matchedBefore") LocalDateTime matchedBefore,
                                          Pageable pageable);

    /**
     * Bump view counters without loading or versioning the offers
     */
    @Modifying
    @Query("UPDATE BuyerOffer o SET o.viewCount = o.viewCount + 1 WHERE o.id IN :ids")
    int incrementViewCounts(@Param("ids") Collection<Long> ids);
}
