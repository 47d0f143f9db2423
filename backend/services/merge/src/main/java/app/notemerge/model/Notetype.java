package app.notemerge.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class Notetype {

    private long id;
    private String name;
    private Instant mtime;
    private int usn;
    private List<NotetypeField> fields;
    private List<CardTemplate> templates;
    private String css;
    private int sortFieldIndex;

    public Notetype(long id,
                    String name,
                    Instant mtime,
                    int usn,
                    List<NotetypeField> fields,
                    List<CardTemplate> templates,
                    String css,
                    int sortFieldIndex) {
        this.id = id;
        this.name = name;
        this.mtime = mtime;
        this.usn = usn;
        this.fields = fields == null ? new ArrayList<>() : new ArrayList<>(fields);
        this.templates = templates == null ? new ArrayList<>() : new ArrayList<>(templates);
        this.css = css;
        this.sortFieldIndex = sortFieldIndex;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Instant getMtime() {
        return mtime;
    }

    public void setMtime(Instant mtime) {
        this.mtime = mtime;
    }

    public int getUsn() {
        return usn;
    }

    public void setUsn(int usn) {
        this.usn = usn;
    }

    public List<NotetypeField> getFields() {
        return fields;
    }

    public void setFields(List<NotetypeField> fields) {
        this.fields = new ArrayList<>(fields);
    }

    public List<CardTemplate> getTemplates() {
        return templates;
    }

    public void setTemplates(List<CardTemplate> templates) {
        this.templates = new ArrayList<>(templates);
    }

    public String getCss() {
        return css;
    }

    public void setCss(String css) {
        this.css = css;
    }

    public int getSortFieldIndex() {
        return sortFieldIndex;
    }

    public void setSortFieldIndex(int sortFieldIndex) {
        this.sortFieldIndex = sortFieldIndex;
    }

    public List<String> fieldNames() {
        return fields.stream().map(NotetypeField::name).toList();
    }

    public List<String> templateNames() {
        return templates.stream().map(CardTemplate::name).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Notetype that = (Notetype) o;
        return id == that.id
                && Objects.equals(name, that.name)
                && Objects.equals(fields, that.fields)
                && Objects.equals(templates, that.templates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, fields, templates);
    }

    @Override
    public String toString() {
        return "Notetype{id=" + id + ", name='" + name + "'}";
    }
}
