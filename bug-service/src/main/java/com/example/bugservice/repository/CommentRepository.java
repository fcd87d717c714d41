package com.example.bugservice.repository;

import com.example.bugservice.entity.Comment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CommentRepository extends JpaRepository<Comment, UUID> {

    List<Comment> findByBugIdOrderByCreatedAtAsc(UUID bugId);

    long countByBugId(UUID bugId);

    /**
     * Relabel all comments of one bug onto another.
     */
    @Modifying
    @Query("UPDATE Comment c SET c.bugId = :targetBugId WHERE c.bugId = :sourceBugId")
    int reassignComments(@Param("sourceBugId") UUID sourceBugId, @Param("targetBugId") UUID targetBugId);
}
