package io.vena.factoid.store;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Names a top-level field of the replicated state held by a {@link ReplicatedStore},
 * and records the type of its value.
 *
 * @see ListField
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public class Field<T> {
	@NonNull private final String name;

	public static <TT> Field<TT> named(String name) {
		return new Field<>(name);
	}

	@Override
	public String toString() {
		return name;
	}
}
