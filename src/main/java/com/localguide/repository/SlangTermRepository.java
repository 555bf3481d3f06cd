package com.localguide.repository;

import com.localguide.entity.SlangTerm;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SlangTermRepository extends JpaRepository<SlangTerm, String> {

    /**
     * 정규화된 용어 + 언어 정확 일치 (저장 순서 유지)
     */
    List<SlangTerm> findByNormalizedTermAndLanguageOrderByCreatedAtAsc(String normalizedTerm, String language);

    List<SlangTerm> findByNormalizedTermOrderByCreatedAtAsc(String normalizedTerm);

    /**
     * 철자 변형 후보 조회: 정규화된 용어가 variant를 포함 (인기도 내림차순)
     */
    @Query("SELECT s FROM SlangTerm s WHERE s.normalizedTerm LIKE CONCAT('%', :variant, '%') "
        + "ORDER BY s.popularity DESC, s.createdAt ASC")
    List<SlangTerm> findFuzzy(@Param("variant") String variant, Pageable pageable);

    /**
     * 용어 또는 지역명 부분 일치 검색 (인기도 내림차순, 용어 오름차순)
     */
    @Query("SELECT s FROM SlangTerm s WHERE LOWER(s.term) LIKE LOWER(CONCAT('%', :query, '%')) "
        + "OR LOWER(s.region) LIKE LOWER(CONCAT('%', :query, '%')) "
        + "ORDER BY s.popularity DESC, s.term ASC")
    List<SlangTerm> searchText(@Param("query") String query, Pageable pageable);

    /**
     * 역방향 번역: targetLanguage 번역문에 query가 포함된 용어들
     * query는 TextNormalizer로 정규화된 값이어야 함 (정규화된 번역문과 비교)
     */
    @Query("SELECT DISTINCT s FROM SlangTerm s JOIN s.translations tr "
        + "WHERE tr.targetLanguage = :language AND tr.normalizedText LIKE LOWER(CONCAT('%', :query, '%')) "
        + "ORDER BY s.popularity DESC")
    List<SlangTerm> findByTranslationText(@Param("query") String query,
                                          @Param("language") String language,
                                          Pageable pageable);

    List<SlangTerm> findByRegionIgnoreCaseOrderByPopularityDesc(String region, Pageable pageable);

    List<SlangTerm> findAllByOrderByPopularityDescTermAsc(Pageable pageable);

    /**
     * 중복 검사: 정규화 용어 + 언어 + 지역(대소문자 무시)
     */
    @Query("SELECT COUNT(s) > 0 FROM SlangTerm s WHERE s.normalizedTerm = :normalizedTerm "
        + "AND s.language = :language AND s.regionKey = LOWER(TRIM(:region))")
    boolean existsDuplicate(@Param("normalizedTerm") String normalizedTerm,
                            @Param("language") String language,
                            @Param("region") String region);

    @Query("SELECT COUNT(s) > 0 FROM SlangTerm s WHERE s.normalizedTerm = :normalizedTerm "
        + "AND s.language = :language AND s.regionKey = LOWER(TRIM(:region)) AND s.id <> :excludeId")
    boolean existsDuplicateExcluding(@Param("normalizedTerm") String normalizedTerm,
                                     @Param("language") String language,
                                     @Param("region") String region,
                                     @Param("excludeId") String excludeId);

    @Query("SELECT s.language, COUNT(s) FROM SlangTerm s GROUP BY s.language")
    List<Object[]> countByLanguage();

    @Query("SELECT s.region, COUNT(s) FROM SlangTerm s GROUP BY s.region")
    List<Object[]> countByRegion();

    @Query("SELECT AVG(s.popularity) FROM SlangTerm s")
    Double averagePopularity();
}
