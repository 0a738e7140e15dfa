package com.vibedeutsch.backend.lexicon.repo;

import com.vibedeutsch.backend.lexicon.entity.InflectedFormEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface InflectedFormRepo extends JpaRepository<InflectedFormEntity, Long> {

    @Query("""
        select f from InflectedFormEntity f
        join fetch f.lemma l
        left join fetch f.sense s
        where f.form = :form
        order by f.id asc
    """)
    List<InflectedFormEntity> findByExactForm(@Param("form") String form);
}
