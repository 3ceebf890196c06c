package io.vena.factoid;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * Published by an {@link ElementSet} when its membership changes.
 *
 * <p>
 * Every change is published as a pair: the generic kind ({@link Kind#ADD}, {@link Kind#REMOVE},
 * {@link Kind#REGROUP}) immediately followed by the kind that says where the change came from
 * (<code>LOCAL_</code> or <code>REMOTE_</code>).
 *
 * @param element the canonical element object; null only for {@link Kind#LOAD_ELEMENTS}
 * @param group the element's group after the change
 * @param oldGroup the element's group before the change; only set for regroups
 */
public record ElementSetEvent<E extends Element>(
	@NonNull Kind kind,
	@Nullable E element,
	@Nullable String group,
	@Nullable String oldGroup
) implements FactoidEvent {

	@Getter
	@Accessors(fluent = true)
	@RequiredArgsConstructor
	public enum Kind {
		ADD("add"),
		REMOTE_ADD("remoteadd"),
		LOCAL_ADD("localadd"),
		REMOVE("remove"),
		REMOTE_REMOVE("remoteremove"),
		LOCAL_REMOVE("localremove"),
		REGROUP("regroup"),
		REMOTE_REGROUP("remoteregroup"),
		LOCAL_REGROUP("localregroup"),
		LOAD_ELEMENTS("loadelements"),
		;

		private final String eventName;
	}

	public static <EE extends Element> ElementSetEvent<EE> of(Kind kind, EE element, @Nullable String group) {
		return new ElementSetEvent<>(kind, element, group, null);
	}

	public static <EE extends Element> ElementSetEvent<EE> loadElements() {
		return new ElementSetEvent<>(Kind.LOAD_ELEMENTS, null, null, null);
	}

	@Override
	public String eventName() {
		return kind.eventName();
	}

	@Override
	public String toString() {
		if (kind == Kind.LOAD_ELEMENTS) {
			return kind.eventName();
		} else if (kind == Kind.REGROUP || kind == Kind.REMOTE_REGROUP || kind == Kind.LOCAL_REGROUP) {
			return kind.eventName() + "(" + element + ": " + oldGroup + " -> " + group + ")";
		} else {
			return kind.eventName() + "(" + element + (group == null ? "" : ", " + group) + ")";
		}
	}
}
