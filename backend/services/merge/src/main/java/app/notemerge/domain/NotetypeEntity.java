package app.notemerge.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Objects;

@Entity
@Table(name = "notetypes", schema = "app_merge")
public class NotetypeEntity {

    @Id
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "mtime", nullable = false)
    private Instant mtime;

    @Column(name = "usn", nullable = false)
    private int usn;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "fields", columnDefinition = "jsonb", nullable = false)
    private JsonNode fields;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "templates", columnDefinition = "jsonb", nullable = false)
    private JsonNode templates;

    @Column(name = "css")
    private String css;

    @Column(name = "sort_field_index", nullable = false)
    private int sortFieldIndex;

    protected NotetypeEntity() {
    }

    public NotetypeEntity(Long id,
                          String name,
                          Instant mtime,
                          int usn,
                          JsonNode fields,
                          JsonNode templates,
                          String css,
                          int sortFieldIndex) {
        this.id = id;
        this.name = name;
        this.mtime = mtime;
        this.usn = usn;
        this.fields = fields;
        this.templates = templates;
        this.css = css;
        this.sortFieldIndex = sortFieldIndex;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Instant getMtime() {
        return mtime;
    }

    public int getUsn() {
        return usn;
    }

    public JsonNode getFields() {
        return fields;
    }

    public JsonNode getTemplates() {
        return templates;
    }

    public String getCss() {
        return css;
    }

    public int getSortFieldIndex() {
        return sortFieldIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        NotetypeEntity that = (NotetypeEntity) o;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }
}
