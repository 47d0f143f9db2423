package app.notemerge.repository;

import app.notemerge.domain.NotetypeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface NotetypeRepository extends JpaRepository<NotetypeEntity, Long> {

    boolean existsByNameAndIdNot(String name, Long id);
}
