package io.vena.factoid;

import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

/**
 * The replicated record of one element's membership in an {@link ElementSet}.
 *
 * <p>
 * An absent group is always <code>null</code>; an empty group is not allowed,
 * so there is exactly one way to say "ungrouped".
 *
 * @param id the id of the member element
 * @param group an opaque tag used by {@link ElementSet#elements(String)}, or null
 */
public record Entry(
	@NonNull Identifier id,
	@Nullable String group
) implements Identified {
	public Entry {
		if (group != null && group.isEmpty()) {
			throw new IllegalArgumentException("Entry group can't be empty; use null for no group");
		}
	}

	public static Entry of(Identifier id) {
		return new Entry(id, null);
	}

	/**
	 * Treats the empty string the same as null.
	 */
	public static Entry of(Identifier id, @Nullable String group) {
		return new Entry(id, normalizedGroup(group));
	}

	public Entry withGroup(@Nullable String newGroup) {
		return new Entry(id, normalizedGroup(newGroup));
	}

	public boolean hasGroup() {
		return group != null;
	}

	static @Nullable String normalizedGroup(@Nullable String group) {
		if (group == null || group.isEmpty()) {
			return null;
		} else {
			return group;
		}
	}
}
