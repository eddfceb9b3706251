package dev.resumetailor.model;

/**
 * A formatted skill string together with how it sits against the character limit.
 */
public record SkillLine(String text, int length, Status status) {

    public enum Status {
        FITS,
        NEAR_LIMIT,
        OVER_LIMIT
    }

    public static SkillLine of(String text, int limit) {
        int length = text.length();
        Status status;
        if (length > limit) {
            status = Status.OVER_LIMIT;
        } else if (length > limit - 5) {
            status = Status.NEAR_LIMIT;
        } else {
            status = Status.FITS;
        }
        return new SkillLine(text, length, status);
    }
}
