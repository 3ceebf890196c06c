package io.vena.factoid.document;

import io.vena.factoid.FactoidEvent;
import io.vena.factoid.Identifier;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * Published by a {@link FactoidDocument} when one of its own fields changes.
 * Like {@link io.vena.factoid.ElementSetEvent}, every change is a pair of events.
 *
 * @param name the new name; only for the rename kinds
 * @param organism the organism toggled; only for the toggle kinds
 * @param on whether <code>organism</code> is now toggled on; only for the toggle kinds
 */
public record DocumentEvent(
	@NonNull Kind kind,
	@Nullable String name,
	@Nullable Identifier organism,
	boolean on
) implements FactoidEvent {

	@Getter
	@Accessors(fluent = true)
	@RequiredArgsConstructor
	public enum Kind {
		RENAME("rename"),
		REMOTE_RENAME("remoterename"),
		LOCAL_RENAME("localrename"),
		TOGGLE_ORGANISM("toggleorganism"),
		REMOTE_TOGGLE_ORGANISM("remotetoggleorganism"),
		LOCAL_TOGGLE_ORGANISM("localtoggleorganism"),
		;

		private final String eventName;
	}

	public static DocumentEvent renamed(Kind kind, @Nullable String name) {
		return new DocumentEvent(kind, name, null, false);
	}

	public static DocumentEvent toggled(Kind kind, Identifier organism, boolean on) {
		return new DocumentEvent(kind, null, organism, on);
	}

	@Override
	public String eventName() {
		return kind.eventName();
	}

	@Override
	public String toString() {
		if (organism == null) {
			return kind.eventName() + "(" + name + ")";
		} else {
			return kind.eventName() + "(" + organism + ", " + on + ")";
		}
	}
}
