package tome.lang;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import lombok.NonNull;

/** Node ids in definition order, and one link per choice or goto statement. */
public record NodeNetwork(@NonNull ImmutableSet<String> nodes, @NonNull ImmutableList<Link> links) {

    public record Link(@NonNull String source, @NonNull String target) {}
}
