package dtm.hexdi.core;

import dtm.hexdi.common.TimeSource;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

@Getter
@Builder(toBuilder = true)
public class ContainerOptions {

    public static final ContainerOptions DEFAULT = ContainerOptions.builder().build();

    @NonNull
    @Builder.Default
    private final ResolutionHooks hooks = ResolutionHooks.NONE;

    @NonNull
    @Builder.Default
    private final ScopedResolutionPolicy scopedResolutionPolicy = ScopedResolutionPolicy.REJECT;

    @NonNull
    @Builder.Default
    private final TimeSource timeSource = TimeSource.SYSTEM;
}
