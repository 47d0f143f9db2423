package app.notemerge.repository;

import app.notemerge.domain.NoteEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface NoteRepository extends JpaRepository<NoteEntity, Long> {

    interface GuidProjection {
        String getGuid();

        Long getId();

        Instant getMtime();

        Long getNotetypeId();
    }

    @Query("select n.id from NoteEntity n")
    List<Long> findAllIds();

    @Query("""
        select n.guid as guid, n.id as id, n.mtime as mtime, n.notetypeId as notetypeId
        from NoteEntity n
        """)
    List<GuidProjection> findGuidIndex();
}
