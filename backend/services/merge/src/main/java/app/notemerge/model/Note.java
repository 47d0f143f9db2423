package app.notemerge.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class Note {

    private long id;
    private String guid;
    private long notetypeId;
    private Instant mtime;
    private int usn;
    private List<String> tags;
    private List<String> fields;
    private String sortField;
    private long checksum;

    public Note(long id,
                String guid,
                long notetypeId,
                Instant mtime,
                int usn,
                List<String> tags,
                List<String> fields) {
        this.id = id;
        this.guid = guid;
        this.notetypeId = notetypeId;
        this.mtime = mtime;
        this.usn = usn;
        this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
        this.fields = fields == null ? new ArrayList<>() : new ArrayList<>(fields);
        this.sortField = "";
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getGuid() {
        return guid;
    }

    public void setGuid(String guid) {
        this.guid = guid;
    }

    public long getNotetypeId() {
        return notetypeId;
    }

    public void setNotetypeId(long notetypeId) {
        this.notetypeId = notetypeId;
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

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = new ArrayList<>(tags);
    }

    /**
     * Live view of the note's fields; callers may replace entries in place.
     */
    public List<String> getFields() {
        return fields;
    }

    public void setFields(List<String> fields) {
        this.fields = new ArrayList<>(fields);
    }

    public String getSortField() {
        return sortField;
    }

    public void setSortField(String sortField) {
        this.sortField = sortField;
    }

    public long getChecksum() {
        return checksum;
    }

    public void setChecksum(long checksum) {
        this.checksum = checksum;
    }

    public void setModified(int usn) {
        this.mtime = Instant.now();
        this.usn = usn;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Note that = (Note) o;
        return id == that.id
                && notetypeId == that.notetypeId
                && Objects.equals(guid, that.guid)
                && Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, guid, notetypeId, fields);
    }

    @Override
    public String toString() {
        return "Note{id=" + id + ", guid='" + guid + "', notetypeId=" + notetypeId + "}";
    }
}
