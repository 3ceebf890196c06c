package io.vena.factoid;

import org.jetbrains.annotations.Nullable;

/**
 * Options for the local mutation methods of {@link ElementSet}.
 *
 * @param silent if true, the set publishes no events for the mutation,
 *               and the store is asked to skip its own side-effects too
 * @param group for {@link ElementSet#add add}, the new member's group;
 *              for {@link ElementSet#regroup regroup}, the group to move to.
 *              Null and the empty string both mean "no group".
 */
public record MutationOptions(
	boolean silent,
	@Nullable String group
) {
	public static final MutationOptions DEFAULT = new MutationOptions(false, null);
	public static final MutationOptions SILENT = new MutationOptions(true, null);

	public static MutationOptions inGroup(@Nullable String group) {
		return new MutationOptions(false, group);
	}

	public MutationOptions asSilent() {
		return new MutationOptions(true, group);
	}
}
