package dtm.hexdi.export;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

@Getter
@Builder
public class DotOptions {

    public static final DotOptions DEFAULT = DotOptions.builder().build();

    public enum Direction { TB, LR }

    public enum Preset { MINIMAL, STYLED }

    @NonNull
    @Builder.Default
    private final Direction direction = Direction.TB;

    @NonNull
    @Builder.Default
    private final Preset preset = Preset.MINIMAL;
}
