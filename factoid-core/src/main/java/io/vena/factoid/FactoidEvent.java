package io.vena.factoid;

/**
 * Something published on a document's {@link EventBus}.
 */
public interface FactoidEvent {
	/**
	 * @return the name under which clients know this kind of event, such as <code>"remoteadd"</code>
	 */
	String eventName();
}
