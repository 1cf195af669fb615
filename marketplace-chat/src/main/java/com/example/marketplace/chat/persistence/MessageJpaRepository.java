package com.example.marketplace.chat.persistence;

import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, String> {

    @Query(
            value = "select m from MessageEntity m "
                    + "where (m.senderId = :self and m.receiverId = :other) "
                    + "or (m.senderId = :other and m.receiverId = :self)",
            countQuery = "select count(m) from MessageEntity m "
                    + "where (m.senderId = :self and m.receiverId = :other) "
                    + "or (m.senderId = :other and m.receiverId = :self)")
    Page<MessageEntity> findConversation(
            @Param("self") String self, @Param("other") String other, Pageable pageable);

    @Query("select m from MessageEntity m "
            + "where m.senderId = :userId or m.receiverId = :userId "
            + "order by m.createdAt desc, m.id desc")
    List<MessageEntity> findAllInvolving(@Param("userId") String userId);

    @Query("select count(m) from MessageEntity m where m.receiverId = :receiverId and m.read = false")
    long countUnread(@Param("receiverId") String receiverId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update MessageEntity m set m.read = true, m.updatedAt = :now "
            + "where m.senderId = :senderId and m.receiverId = :receiverId and m.read = false")
    int markRead(
            @Param("senderId") String senderId,
            @Param("receiverId") String receiverId,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update MessageEntity m set m.delivered = true, m.deliveredAt = :deliveredAt, m.updatedAt = :deliveredAt "
            + "where m.id = :id and m.delivered = false")
    int markDelivered(@Param("id") String id, @Param("deliveredAt") Instant deliveredAt);
}
