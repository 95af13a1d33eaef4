package com.jimin.river.repository;

import com.jimin.river.entity.EntryFilter;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EntryFilterRepository extends JpaRepository<EntryFilter, Long> {
}
