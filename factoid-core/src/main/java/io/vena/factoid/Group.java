package io.vena.factoid;

import org.jetbrains.annotations.Nullable;

/**
 * The group of a member of an {@link ElementSet}.
 * A member with no group has {@link #NONE}, whose name is null.
 *
 * @see ElementSet#group(Identifier)
 */
public record Group(@Nullable String name) {
	public static final Group NONE = new Group(null);

	public Group {
		name = Entry.normalizedGroup(name);
	}

	public static Group of(@Nullable String name) {
		return new Group(name);
	}

	public boolean isNone() {
		return name == null;
	}
}
