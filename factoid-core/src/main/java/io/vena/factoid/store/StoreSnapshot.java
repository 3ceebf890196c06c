package io.vena.factoid.store;

import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import io.vena.factoid.exceptions.InvariantViolationException;
import java.util.List;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * An immutable view of all the fields held by a {@link ReplicatedStore} at one instant.
 *
 * <p>
 * The <code>with</code> methods return modified copies and implement the semantics
 * of the corresponding {@link ReplicatedStore} update operations, so every store
 * implementation applies updates the same way.
 * List values are always immutable, and lists of {@link Identified} items never
 * contain two items with the same id.
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class StoreSnapshot {
	private final PMap<String, Object> values;

	private static final StoreSnapshot EMPTY = new StoreSnapshot(HashTreePMap.empty());

	public static StoreSnapshot empty() {
		return EMPTY;
	}

	public boolean declares(Field<?> field) {
		return values.containsKey(field.name());
	}

	/**
	 * @return the value of <code>field</code>, or null if it's not {@link #declares declared}
	 */
	@SuppressWarnings("unchecked")
	public <T> @Nullable T get(Field<T> field) {
		return (T) values.get(field.name());
	}

	/**
	 * @return the value of <code>field</code>, or an empty list if it's not {@link #declares declared}
	 */
	public <T> List<T> list(ListField<T> field) {
		List<T> result = get(field);
		if (result == null) {
			return TreePVector.empty();
		} else {
			return result;
		}
	}

	public boolean changed(Field<?> field, StoreSnapshot other) {
		return !Objects.equals(this.get(field), other.get(field));
	}

	@SuppressWarnings("unchecked")
	public <T> StoreSnapshot with(Field<T> field, @NonNull T value) {
		Object stored = value;
		if (field instanceof ListField) {
			List<Object> list = TreePVector.from((List<Object>) value);
			assertUniqueIDs(field, list);
			stored = list;
		}
		return new StoreSnapshot(values.plus(field.name(), stored));
	}

	public StoreSnapshot without(Field<?> field) {
		return new StoreSnapshot(values.minus(field.name()));
	}

	/**
	 * Appends <code>item</code> to the list, declaring the list if necessary.
	 *
	 * @throws InvariantViolationException if <code>item</code> is {@link Identified}
	 * and the list already has an item with the same id
	 */
	public <T> StoreSnapshot withPushed(ListField<T> field, @NonNull T item) {
		PVector<T> list = vector(field);
		if (item instanceof Identified identified && indexOf(list, identified.id()) >= 0) {
			throw new InvariantViolationException("Field \"" + field + "\" already has an item with id " + identified.id());
		}
		return new StoreSnapshot(values.plus(field.name(), list.plus(item)));
	}

	/**
	 * Removes every item equal to <code>item</code>.
	 */
	public <T> StoreSnapshot withPulled(ListField<T> field, @NonNull T item) {
		PVector<T> list = vector(field);
		PVector<T> result = list;
		while (result.contains(item)) {
			result = result.minus((Object) item);
		}
		if (result == list) {
			return this;
		}
		return new StoreSnapshot(values.plus(field.name(), result));
	}

	public <T extends Identified> StoreSnapshot withPulledByID(ListField<T> field, @NonNull Identifier id) {
		PVector<T> list = vector(field);
		int index = indexOf(list, id);
		if (index < 0) {
			return this;
		}
		return new StoreSnapshot(values.plus(field.name(), list.minus(index)));
	}

	/**
	 * Replaces the item having the same id as <code>replacement</code>, in place.
	 * If there is no such item, the list is unchanged.
	 */
	public <T extends Identified> StoreSnapshot withMergedByID(ListField<T> field, @NonNull T replacement) {
		PVector<T> list = vector(field);
		int index = indexOf(list, replacement.id());
		if (index < 0) {
			return this;
		}
		return new StoreSnapshot(values.plus(field.name(), list.with(index, replacement)));
	}

	@SuppressWarnings("unchecked")
	private <T> PVector<T> vector(ListField<T> field) {
		Object value = values.get(field.name());
		if (value == null) {
			return TreePVector.empty();
		} else {
			return (PVector<T>) value;
		}
	}

	private static int indexOf(List<?> list, Identifier id) {
		for (int i = 0; i < list.size(); i++) {
			if (list.get(i) instanceof Identified item && item.id().equals(id)) {
				return i;
			}
		}
		return -1;
	}

	private static void assertUniqueIDs(Field<?> field, List<?> list) {
		for (int i = 0; i < list.size(); i++) {
			if (list.get(i) instanceof Identified item && indexOf(list, item.id()) != i) {
				throw new InvariantViolationException("Field \"" + field + "\" has more than one item with id " + item.id());
			}
		}
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
