package com.localguide.repository;

import com.localguide.entity.Favorite;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FavoriteRepository extends JpaRepository<Favorite, Long> {

    List<Favorite> findByUserIdOrderByDateAddedDesc(String userId);

    Optional<Favorite> findByIdAndUserId(Long id, String userId);
}
