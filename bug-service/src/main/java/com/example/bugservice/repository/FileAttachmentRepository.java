package com.example.bugservice.repository;

import com.example.bugservice.entity.FileAttachment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FileAttachmentRepository extends JpaRepository<FileAttachment, UUID> {

    List<FileAttachment> findByBugIdOrderByUploadedAtAsc(UUID bugId);

    long countByBugId(UUID bugId);

    @Modifying
    @Query("UPDATE FileAttachment f SET f.bugId = :targetBugId WHERE f.bugId = :sourceBugId")
    int reassignAttachments(@Param("sourceBugId") UUID sourceBugId, @Param("targetBugId") UUID targetBugId);
}
