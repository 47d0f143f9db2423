package app.notemerge.collection;

import app.notemerge.config.MergeProps;
import app.notemerge.domain.NoteEntity;
import app.notemerge.domain.NotetypeEntity;
import app.notemerge.domain.TagEntity;
import app.notemerge.model.CardTemplate;
import app.notemerge.model.Note;
import app.notemerge.model.NoteMeta;
import app.notemerge.model.Notetype;
import app.notemerge.model.NotetypeField;
import app.notemerge.repository.NoteRepository;
import app.notemerge.repository.NotetypeRepository;
import app.notemerge.repository.TagRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class JpaTargetCollection implements TargetCollection {

    private static final Pattern TAG_WHITESPACE = Pattern.compile("\\s+");
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<NotetypeField>> FIELD_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<CardTemplate>> TEMPLATE_LIST = new TypeReference<>() {
    };

    private final NoteRepository noteRepository;
    private final NotetypeRepository notetypeRepository;
    private final TagRepository tagRepository;
    private final ObjectMapper objectMapper;
    private final MergeProps props;
    private final Clock clock;

    public JpaTargetCollection(NoteRepository noteRepository,
                               NotetypeRepository notetypeRepository,
                               TagRepository tagRepository,
                               ObjectMapper objectMapper,
                               MergeProps props) {
        this(noteRepository, notetypeRepository, tagRepository, objectMapper, props, Clock.systemUTC());
    }

    JpaTargetCollection(NoteRepository noteRepository,
                        NotetypeRepository notetypeRepository,
                        TagRepository tagRepository,
                        ObjectMapper objectMapper,
                        MergeProps props,
                        Clock clock) {
        this.noteRepository = noteRepository;
        this.notetypeRepository = notetypeRepository;
        this.tagRepository = tagRepository;
        this.objectMapper = objectMapper;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public int usn() {
        return props.usn();
    }

    @Override
    public boolean normalizeNoteText() {
        return props.normalizeNoteText();
    }

    @Override
    public Optional<Notetype> getNotetype(long notetypeId) {
        return notetypeRepository.findById(notetypeId).map(this::toNotetype);
    }

    @Override
    public void ensureNotetypeNameUnique(Notetype notetype) {
        String name = notetype.getName();
        while (notetypeRepository.existsByNameAndIdNot(name, notetype.getId())) {
            name = name + "+";
        }
        notetype.setName(name);
    }

    @Override
    public void addNotetypeWithId(Notetype notetype) {
        notetypeRepository.save(toEntity(notetype));
    }

    @Override
    public long addNotetypeWithNewId(Notetype notetype) {
        long candidate = clock.millis();
        while (notetypeRepository.existsById(candidate)) {
            candidate++;
        }
        notetype.setId(candidate);
        notetypeRepository.save(toEntity(notetype));
        return candidate;
    }

    @Override
    public void updateNotetype(Notetype notetype) {
        notetypeRepository.save(toEntity(notetype));
    }

    @Override
    public Optional<Note> getNote(long noteId) {
        return noteRepository.findById(noteId).map(this::toNote);
    }

    @Override
    public void addNoteWithId(Note note) {
        noteRepository.save(toEntity(note));
    }

    @Override
    public void updateNote(Note note) {
        noteRepository.save(toEntity(note));
    }

    @Override
    public Set<Long> allNoteIds() {
        return new HashSet<>(noteRepository.findAllIds());
    }

    @Override
    public Map<String, NoteMeta> noteGuidMap() {
        Map<String, NoteMeta> index = new HashMap<>();
        for (NoteRepository.GuidProjection row : noteRepository.findGuidIndex()) {
            index.putIfAbsent(row.getGuid(), new NoteMeta(row.getId(), row.getMtime(), row.getNotetypeId()));
        }
        return index;
    }

    @Override
    public void canonifyNoteTags(Note note, int usn) {
        Map<String, String> canonical = new LinkedHashMap<>();
        for (String raw : note.getTags()) {
            String tag = normalizeTag(raw);
            if (tag.isEmpty()) {
                continue;
            }
            String key = tag.toLowerCase(Locale.ROOT);
            if (canonical.containsKey(key)) {
                continue;
            }
            String registered = tagRepository.findFirstByNameIgnoreCase(tag)
                    .map(TagEntity::getName)
                    .orElseGet(() -> tagRepository.save(new TagEntity(tag, usn)).getName());
            canonical.put(key, registered);
        }
        List<String> tags = new ArrayList<>(canonical.values());
        tags.sort(String.CASE_INSENSITIVE_ORDER);
        note.setTags(tags);
    }

    static String normalizeTag(String raw) {
        if (raw == null) {
            return "";
        }
        return TAG_WHITESPACE.matcher(raw.trim()).replaceAll("_");
    }

    private Notetype toNotetype(NotetypeEntity entity) {
        return new Notetype(
                entity.getId(),
                entity.getName(),
                entity.getMtime(),
                entity.getUsn(),
                objectMapper.convertValue(entity.getFields(), FIELD_LIST),
                objectMapper.convertValue(entity.getTemplates(), TEMPLATE_LIST),
                entity.getCss(),
                entity.getSortFieldIndex()
        );
    }

    private NotetypeEntity toEntity(Notetype notetype) {
        return new NotetypeEntity(
                notetype.getId(),
                notetype.getName(),
                notetype.getMtime(),
                notetype.getUsn(),
                objectMapper.valueToTree(notetype.getFields()),
                objectMapper.valueToTree(notetype.getTemplates()),
                notetype.getCss(),
                notetype.getSortFieldIndex()
        );
    }

    private Note toNote(NoteEntity entity) {
        Note note = new Note(
                entity.getId(),
                entity.getGuid(),
                entity.getNotetypeId(),
                entity.getMtime(),
                entity.getUsn(),
                splitTags(entity.getTags()),
                readFields(entity.getFields())
        );
        note.setSortField(entity.getSortField());
        note.setChecksum(entity.getChecksum());
        return note;
    }

    private NoteEntity toEntity(Note note) {
        return new NoteEntity(
                note.getId(),
                note.getGuid(),
                note.getNotetypeId(),
                note.getMtime(),
                note.getUsn(),
                String.join(" ", note.getTags()),
                objectMapper.valueToTree(note.getFields()),
                note.getSortField(),
                note.getChecksum()
        );
    }

    private List<String> readFields(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        return objectMapper.convertValue(node, STRING_LIST);
    }

    private List<String> splitTags(String tags) {
        if (tags == null || tags.isBlank()) {
            return List.of();
        }
        return Arrays.asList(TAG_WHITESPACE.split(tags.trim()));
    }
}
