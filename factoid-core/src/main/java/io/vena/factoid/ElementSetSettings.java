package io.vena.factoid;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class ElementSetSettings {
	/**
	 * Appears in log messages.
	 */
	@Default String name = "elements";

	/**
	 * When the store rejects a local mutation, undo the optimistic change to the
	 * set's index and publish events that describe the undo.
	 * If false, the index keeps the optimistic change and only the caller hears about the failure.
	 */
	@Default boolean compensateOnRejection = true;

	public static ElementSetSettings defaults() {
		return builder().build();
	}
}
