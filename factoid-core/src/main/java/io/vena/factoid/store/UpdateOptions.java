package io.vena.factoid.store;

/**
 * @param silent if true, the store skips its own side-effects for the update,
 *               such as notifying {@link ReplicatedStore#onLocalUpdate local update} listeners.
 *               The update is still replicated.
 */
public record UpdateOptions(boolean silent) {
	public static final UpdateOptions LOUD = new UpdateOptions(false);
	public static final UpdateOptions SILENT = new UpdateOptions(true);

	public static UpdateOptions silentIf(boolean silent) {
		return silent ? SILENT : LOUD;
	}
}
