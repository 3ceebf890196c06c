package io.vena.factoid.store;

import java.util.List;
import lombok.EqualsAndHashCode;

/**
 * A {@link Field} whose value is an immutable list, supporting the
 * list-specific operations of {@link ReplicatedStore} such as {@link ReplicatedStore#push push}.
 */
@EqualsAndHashCode(callSuper = true)
public final class ListField<T> extends Field<List<T>> {
	private ListField(String name) {
		super(name);
	}

	public static <TT> ListField<TT> listNamed(String name) {
		return new ListField<>(name);
	}
}
