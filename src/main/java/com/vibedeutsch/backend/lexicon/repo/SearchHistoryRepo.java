package com.vibedeutsch.backend.lexicon.repo;

import com.vibedeutsch.backend.lexicon.entity.SearchHistoryEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface SearchHistoryRepo extends JpaRepository<SearchHistoryEntity, Long> {

    @Query("""
        select h.id from SearchHistoryEntity h
        where h.createdAt < :cutoff
        order by h.id asc
    """)
    List<Long> findIdsOlderThan(@Param("cutoff") Instant cutoff, Pageable page);

    @Modifying
    @Query("delete from SearchHistoryEntity h where h.id in :ids")
    int deleteByIds(@Param("ids") List<Long> ids);
}
