package ops;

import java.util.Locale;
import java.util.Optional;

/** Every transform the editor knows, with its external identifier. */
public enum OperationKind {

    // basic
    BRIGHTNESS("brightness", Category.BASIC),
    CONTRAST("contrast", Category.BASIC),
    SATURATION("saturation", Category.BASIC),
    EXPOSURE("exposure", Category.BASIC),
    COLOR_TEMPERATURE("color-temperature", Category.BASIC),
    CROP("crop", Category.BASIC),
    ROTATE("rotate", Category.BASIC),
    RESIZE("resize", Category.BASIC),
    GRAYSCALE("grayscale", Category.BASIC),
    FLIP("flip", Category.BASIC),
    FLATTEN("flatten", Category.BASIC),
    BLUR("blur", Category.BASIC),
    SHARPEN("sharpen", Category.BASIC),

    // artistic
    OIL_PAINTING("oil-painting", Category.ARTISTIC),
    CHARCOAL("charcoal", Category.ARTISTIC),
    SEPIA("sepia", Category.ARTISTIC),
    GRAIN("grain", Category.ARTISTIC),
    EMBOSS("emboss", Category.ARTISTIC),
    SWIRL("swirl", Category.ARTISTIC),
    WAVE("wave", Category.ARTISTIC),
    IMPLODE("implode", Category.ARTISTIC),

    // tone
    DUOTONE("duotone", Category.TONE),
    SPLIT_TONING("split-toning", Category.TONE),
    LEVELS("levels", Category.TONE),
    COLOR_BALANCE("color-balance", Category.TONE),

    // special
    NEGATIVE("negative", Category.SPECIAL),
    POSTERIZE("posterize", Category.SPECIAL),
    SOLARIZE("solarize", Category.SPECIAL),
    PIXELATE("pixelate", Category.SPECIAL),
    CRYSTALLIZE("crystallize", Category.SPECIAL),
    EDGE_DETECTION("edge-detection", Category.SPECIAL),
    VIGNETTE("vignette", Category.SPECIAL);

    public enum Category {
        BASIC, ARTISTIC, TONE, SPECIAL
    }

    private final String id;
    private final Category category;

    OperationKind(String id, Category category) {
        this.id = id;
        this.category = category;
    }

    public String id() {
        return id;
    }

    public Category category() {
        return category;
    }

    /** Look up by identifier; case and '_' vs '-' are ignored. */
    public static Optional<OperationKind> fromId(String id) {
        if (id == null)
            return Optional.empty();
        String norm = id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (OperationKind k : values()) {
            if (k.id.equals(norm))
                return Optional.of(k);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
