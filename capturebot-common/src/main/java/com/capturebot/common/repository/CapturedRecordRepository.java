package com.capturebot.common.repository;

import com.capturebot.common.entity.CapturedRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CapturedRecordRepository extends JpaRepository<CapturedRecord, UUID> {

    // Most recent records for a sender, any type
    List<CapturedRecord> findBySenderIdOrderByCreatedAtDesc(String senderId, Pageable pageable);

    /**
     * Cosine similarity search through the wbot_match_records SQL function.
     * Rows come back ordered by descending similarity.
     */
    @Query(value = "SELECT CAST(m.id AS varchar) AS recordId, m.similarity AS similarity " +
            "FROM wbot_match_records(CAST(:embedding AS vector), :matchCount, :senderId) m",
            nativeQuery = true)
    List<SimilarityRow> matchRecords(@Param("embedding") String embedding,
            @Param("matchCount") int matchCount,
            @Param("senderId") String senderId);

    interface SimilarityRow {
        String getRecordId();

        Double getSimilarity();
    }
}
