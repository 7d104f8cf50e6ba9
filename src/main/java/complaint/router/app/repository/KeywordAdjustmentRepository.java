package complaint.router.app.repository;

import complaint.router.app.entity.KeywordAdjustment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface KeywordAdjustmentRepository extends JpaRepository<KeywordAdjustment, String> {
    List<KeywordAdjustment> findByCandidateFalse();
    List<KeywordAdjustment> findByCandidateTrueOrderBySignalCountDesc();
}
