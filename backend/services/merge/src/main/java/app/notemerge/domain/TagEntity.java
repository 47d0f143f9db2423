package app.notemerge.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "tags", schema = "app_merge")
public class TagEntity {

    @Id
    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "usn", nullable = false)
    private int usn;

    protected TagEntity() {
    }

    public TagEntity(String name, int usn) {
        this.name = name;
        this.usn = usn;
    }

    public String getName() {
        return name;
    }

    public int getUsn() {
        return usn;
    }
}
