package com.lastmile.locationtracking.repository;

import com.lastmile.locationtracking.entity.ContainmentState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ContainmentStateRepository extends JpaRepository<ContainmentState, ContainmentState.Key> {
}
