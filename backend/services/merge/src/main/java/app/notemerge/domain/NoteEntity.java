package app.notemerge.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Objects;

@Entity
@Table(name = "notes", schema = "app_merge")
public class NoteEntity {

    @Id
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "guid", nullable = false)
    private String guid;

    @Column(name = "notetype_id", nullable = false)
    private Long notetypeId;

    @Column(name = "mtime", nullable = false)
    private Instant mtime;

    @Column(name = "usn", nullable = false)
    private int usn;

    @Column(name = "tags", nullable = false)
    private String tags;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "fields", columnDefinition = "jsonb", nullable = false)
    private JsonNode fields;

    @Column(name = "sort_field", nullable = false)
    private String sortField;

    @Column(name = "checksum", nullable = false)
    private long checksum;

    protected NoteEntity() {
    }

    public NoteEntity(Long id,
                      String guid,
                      Long notetypeId,
                      Instant mtime,
                      int usn,
                      String tags,
                      JsonNode fields,
                      String sortField,
                      long checksum) {
        this.id = id;
        this.guid = guid;
        this.notetypeId = notetypeId;
        this.mtime = mtime;
        this.usn = usn;
        this.tags = tags;
        this.fields = fields;
        this.sortField = sortField;
        this.checksum = checksum;
    }

    public Long getId() {
        return id;
    }

    public String getGuid() {
        return guid;
    }

    public Long getNotetypeId() {
        return notetypeId;
    }

    public Instant getMtime() {
        return mtime;
    }

    public int getUsn() {
        return usn;
    }

    public String getTags() {
        return tags;
    }

    public JsonNode getFields() {
        return fields;
    }

    public String getSortField() {
        return sortField;
    }

    public long getChecksum() {
        return checksum;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        NoteEntity that = (NoteEntity) o;
        return Objects.equals(id, that.id) && Objects.equals(guid, that.guid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, guid);
    }
}
