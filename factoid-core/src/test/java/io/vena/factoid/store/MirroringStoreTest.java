package io.vena.factoid.store;

import ch.qos.logback.classic.Level;
import io.vena.factoid.Entry;
import io.vena.factoid.EventBus;
import io.vena.factoid.EventRecorder;
import io.vena.factoid.FactoidEvent;
import io.vena.factoid.FactoryElementCache;
import io.vena.factoid.Group;
import io.vena.factoid.Identifier;
import io.vena.factoid.MutationOptions;
import io.vena.factoid.TestElement;
import io.vena.factoid.document.FactoidDocument;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static io.vena.factoid.ElementSet.ENTRIES;
import static java.util.Collections.emptyList;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Two sessions editing the same document, each mirroring its updates into the other.
 */
class MirroringStoreTest {
	static final Identifier docID = Identifier.from("doc1");
	static final Identifier ele1 = Identifier.from("ele1");

	Session alice;
	Session bob;
	Deque<Runnable> tearDownActions;

	@BeforeEach
	void setUp() {
		tearDownActions = new ArrayDeque<>();
		StoreSnapshot initial = FactoidDocument.initialState(docID, "Shared");
		LocalStore aliceState = new LocalStore("alice", initial);
		LocalStore bobState = new LocalStore("bob", initial);
		alice = new Session(MirroringStore.targeting(bobState, aliceState), aliceState);
		bob = new Session(MirroringStore.targeting(aliceState, bobState), bobState);
	}

	@AfterEach
	void tearDown() {
		alice.document.close();
		bob.document.close();
		tearDownActions.forEach(Runnable::run);
	}

	@Test
	void localAdd_seenRemotelyByOtherSession() {
		TestElement aliceElement = new TestElement(ele1);
		alice.document.add(aliceElement, MutationOptions.inGroup("g")).join();

		assertTrue(bob.document.has(ele1));
		TestElement bobElement = bob.document.get(ele1).orElseThrow();
		assertNotSame(aliceElement, bobElement, "Each session should have its own element objects");
		assertEquals(List.of(bobElement), bob.document.elements("g"));
		assertEquals(List.of("add", "localadd"), alice.recorder.eventNames());
		assertEquals(List.of("add", "remoteadd"), bob.recorder.eventNames());
	}

	@Test
	void regroupAndRemove_roundTrip() {
		alice.document.add(new TestElement(ele1)).join();
		bob.document.elementSet().regroup(ele1, "g").join();
		assertEquals(Optional.of(Group.of("g")), alice.document.elementSet().group(ele1));

		bob.document.remove(bob.document.get(ele1).orElseThrow()).join();
		assertFalse(alice.document.has(ele1));
		assertEquals(List.of("add", "localadd", "regroup", "remoteregroup", "remove", "remoteremove"), alice.recorder.eventNames());
		assertEquals(List.of("add", "remoteadd", "regroup", "localregroup", "remove", "localremove"), bob.recorder.eventNames());
	}

	@Test
	void renameAndOrganisms_replicated() {
		Identifier human = Identifier.from("9606");
		alice.document.rename("Alice's factoid").join();
		alice.document.toggleOrganism(human, true).join();

		assertEquals("Alice's factoid", bob.document.name());
		assertEquals(List.of(human), bob.document.toggledOrganisms());
		assertEquals(List.of("rename", "remoterename", "toggleorganism", "remotetoggleorganism"), bob.recorder.eventNames());
	}

	@Test
	void silentUpdate_stillReplicated() {
		alice.document.add(new TestElement(ele1), MutationOptions.SILENT).join();
		assertEquals(emptyList(), alice.recorder.eventNames());
		assertTrue(bob.document.has(ele1));
		assertEquals(List.of("add", "remoteadd"), bob.recorder.eventNames());
	}

	@Test
	void mirrorRejection_doesNotFailTheUpdate() {
		setLogging(Level.OFF, MirroringStore.class);
		setLogging(Level.OFF, LocalStore.class);
		bob.state.receiveRemote(s -> s.withPushed(ENTRIES, Entry.of(ele1))).join();

		alice.document.add(new TestElement(ele1)).join();
		assertTrue(alice.document.has(ele1));
		assertEquals(List.of(Entry.of(ele1)), bob.state.snapshot().list(ENTRIES));
	}

	private void setLogging(Level level, Class<?> loggerClass) {
		ch.qos.logback.classic.Logger logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(loggerClass);
		Level originalLevel = logger.getLevel();
		tearDownActions.addFirst(() -> logger.setLevel(originalLevel));
		logger.setLevel(level);
	}

	static final class Session {
		final LocalStore state;
		final EventRecorder recorder = new EventRecorder();
		final FactoidDocument<TestElement> document;

		Session(ReplicatedStore store, LocalStore state) {
			this.state = state;
			EventBus<FactoidEvent> bus = new EventBus<>(state.name());
			bus.subscribe("recorder", recorder);
			FactoryElementCache<TestElement> cache = new FactoryElementCache<>(id -> completedFuture(new TestElement(id)));
			this.document = new FactoidDocument<>(bus, store, cache);
		}
	}
}
