package app.notemerge.model;

public record CardTemplate(
        String name,
        int ord,
        String questionFormat,
        String answerFormat
) {
}
