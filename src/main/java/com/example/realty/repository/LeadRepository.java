package com.example.realty.repository;

import com.example.realty.model.Channel;
import com.example.realty.model.ConversationState;
import com.example.realty.model.Lead;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface LeadRepository extends JpaRepository<Lead, Long> {

    Optional<Lead> findByTenantIdAndChannelAndChannelIdentity(Long tenantId, Channel channel, String channelIdentity);

    @Query("""
            select l from Lead l
            where l.followupEnabled = true
              and l.nextFollowupAt is not null
              and l.nextFollowupAt <= :now
              and l.conversationState not in :excluded
              and l.followupClaimToken is null
            order by l.nextFollowupAt asc
            """)
    List<Lead> findDueForFollowup(@Param("now") LocalDateTime now,
                                  @Param("excluded") Collection<ConversationState> excluded,
                                  Pageable page);

    @Query("""
            select l from Lead l
            where l.ghostReminderSent = false
              and l.phone is not null
              and l.lastInteractionAt is not null
              and l.lastInteractionAt <= :cutoff
              and l.conversationState not in :excluded
              and l.followupClaimToken is null
            order by l.lastInteractionAt asc
            """)
    List<Lead> findGhostCandidates(@Param("cutoff") LocalDateTime cutoff,
                                   @Param("excluded") Collection<ConversationState> excluded,
                                   Pageable page);

    @Query("select l from Lead l where l.followupClaimToken is not null and l.followupClaimedAt < :before")
    List<Lead> findStaleClaims(@Param("before") LocalDateTime before);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Lead l set l.followupClaimToken = :token, l.followupClaimedAt = :now
            where l.id = :id
              and l.followupClaimToken is null
              and l.followupEnabled = true
              and l.nextFollowupAt is not null
              and l.nextFollowupAt <= :now
              and l.conversationState not in :excluded
            """)
    int claimDrip(@Param("id") Long id,
                  @Param("token") String token,
                  @Param("now") LocalDateTime now,
                  @Param("excluded") Collection<ConversationState> excluded);

    /** manual trigger from the admin surface: ignores the due time */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Lead l set l.followupClaimToken = :token, l.followupClaimedAt = :now
            where l.id = :id
              and l.followupClaimToken is null
              and l.followupEnabled = true
              and l.conversationState not in :excluded
            """)
    int claimDripForced(@Param("id") Long id,
                        @Param("token") String token,
                        @Param("now") LocalDateTime now,
                        @Param("excluded") Collection<ConversationState> excluded);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Lead l set l.followupClaimToken = :token, l.followupClaimedAt = :now
            where l.id = :id
              and l.followupClaimToken is null
              and l.ghostReminderSent = false
              and l.conversationState not in :excluded
            """)
    int claimGhost(@Param("id") Long id,
                   @Param("token") String token,
                   @Param("now") LocalDateTime now,
                   @Param("excluded") Collection<ConversationState> excluded);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Lead l set l.followupStage = :stage,
                              l.nextFollowupAt = :nextAt,
                              l.followupEnabled = :enabled,
                              l.lastContactedAt = :now,
                              l.followupClaimToken = null,
                              l.followupClaimedAt = null
            where l.id = :id and l.followupClaimToken = :token
            """)
    int commitDrip(@Param("id") Long id,
                   @Param("token") String token,
                   @Param("stage") int stage,
                   @Param("nextAt") LocalDateTime nextAt,
                   @Param("enabled") boolean enabled,
                   @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Lead l set l.ghostReminderSent = true,
                              l.lastContactedAt = :now,
                              l.followupClaimToken = null,
                              l.followupClaimedAt = null
            where l.id = :id and l.followupClaimToken = :token
            """)
    int commitGhost(@Param("id") Long id, @Param("token") String token, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Lead l set l.followupClaimToken = null, l.followupClaimedAt = null
            where l.id = :id and l.followupClaimToken = :token
            """)
    int releaseClaim(@Param("id") Long id, @Param("token") String token);
}
