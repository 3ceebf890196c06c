package io.vena.factoid;

import ch.qos.logback.classic.Level;
import io.vena.factoid.exceptions.HydrationFailureException;
import io.vena.factoid.store.Field;
import io.vena.factoid.store.LocalStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

import static io.vena.factoid.ElementSet.ENTRIES;
import static io.vena.factoid.ElementSetEvent.Kind.ADD;
import static io.vena.factoid.ElementSetEvent.Kind.LOAD_ELEMENTS;
import static io.vena.factoid.ElementSetEvent.Kind.REGROUP;
import static io.vena.factoid.ElementSetEvent.Kind.REMOTE_ADD;
import static io.vena.factoid.ElementSetEvent.Kind.REMOTE_REGROUP;
import static io.vena.factoid.ElementSetEvent.Kind.REMOTE_REMOVE;
import static io.vena.factoid.ElementSetEvent.Kind.REMOVE;
import static java.util.Collections.emptyList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ElementSetReconciliationTest extends AbstractElementSetTest {

	@Test
	void emptyDocument_loadThenRemoteAdd() {
		elementSet.loadElements().join();
		assertEquals(List.of(ElementSetEvent.<TestElement>loadElements()), recorder.events());
		assertEquals(0, elementSet.size());

		recorder.restart();
		remoteEntries(Entry.of(id1)).join();
		TestElement e1 = element(id1);
		assertEquals(1, elementSet.size());
		assertEquals(List.of(event(ADD, e1), event(REMOTE_ADD, e1)), recorder.events());
		assertEquals(List.of(e1), elementSet.elements());
	}

	@Test
	void remoteAddAndRemove_addsPublishedFirst() {
		remoteEntries(Entry.of(id2)).join();
		TestElement e2 = element(id2);
		recorder.restart();

		remoteEntries(Entry.of(id1)).join();
		TestElement e1 = element(id1);
		assertEquals(List.of(
			event(ADD, e1),
			event(REMOTE_ADD, e1),
			event(REMOVE, e2),
			event(REMOTE_REMOVE, e2)
		), recorder.events());
		assertTrue(elementSet.has(id1));
		assertFalse(elementSet.has(id2));
	}

	@Test
	void remoteRegroup_publishesRegroupsLast() {
		remoteEntries(new Entry(id1, "a"), Entry.of(id2)).join();
		TestElement e1 = element(id1);
		TestElement e2 = element(id2);
		recorder.restart();

		remoteEntries(new Entry(id1, "b"), Entry.of(id3)).join();
		TestElement e3 = element(id3);
		assertEquals(List.of(
			event(ADD, e3),
			event(REMOTE_ADD, e3),
			event(REMOVE, e2),
			event(REMOTE_REMOVE, e2),
			regroupEvent(REGROUP, e1, "b", "a"),
			regroupEvent(REMOTE_REGROUP, e1, "b", "a")
		), recorder.events());
		assertEquals(List.of(e1), elementSet.elements("b"));
	}

	@Test
	void consecutiveDiffs_reconciledInOrder() {
		factory.deferred = true;
		CompletableFuture<Void> firstDiff = remoteEntries(new Entry(id1, "a"));
		CompletableFuture<Void> secondDiff = remoteEntries(new Entry(id1, "b"));
		factory.release(id1);
		firstDiff.join();
		secondDiff.join();

		TestElement e1 = element(id1);
		assertEquals(List.of(event(ADD, e1, "a"), event(REMOTE_ADD, e1, "a"), regroupEvent(REGROUP, e1, "b", "a"), regroupEvent(REMOTE_REGROUP, e1, "b", "a")), recorder.events(),
			"Diffs should be reconciled one at a time");
	}

	@Test
	void diffWithoutEntryChange_isIgnored() {
		remoteEntries(Entry.of(id1)).join();
		recorder.restart();
		int requestsBefore = factory.requests.size();

		store.receiveRemote(s -> s.with(Field.<String>named("name"), "Renamed")).join();
		assertEquals(emptyList(), recorder.events());
		assertEquals(requestsBefore, factory.requests.size());
	}

	@Test
	void pendingHydration_indexUnchangedUntilCommit() {
		remoteEntries(Entry.of(id2)).join();
		TestElement e2 = element(id2);
		factory.deferred = true;
		recorder.restart();

		List<String> observations = new ArrayList<>();
		bus.subscribe("observer", ElementSetEvent.class, event ->
			observations.add(event.eventName() + ": has(e1)=" + elementSet.has(id1) + " has(e2)=" + elementSet.has(id2)));

		CompletableFuture<Void> reconciled = remoteEntries(Entry.of(id1));
		assertTrue(factory.isWaitingFor(id1));
		assertFalse(elementSet.has(id1));
		assertTrue(elementSet.has(id2), "Removal shouldn't be visible before the additions are ready");
		assertSame(e2, elementSet.get(id2).orElseThrow());
		assertEquals(emptyList(), recorder.events());

		factory.release(id1);
		reconciled.join();
		assertEquals(List.of(
			"add: has(e1)=true has(e2)=false",
			"remoteadd: has(e1)=true has(e2)=false",
			"remove: has(e1)=true has(e2)=false",
			"remoteremove: has(e1)=true has(e2)=false"
		), observations, "Every listener should see the fully committed index");
	}

	@Test
	void unhydratedEntry_omittedFromQueries() {
		remoteEntries(Entry.of(id1)).join();
		factory.deferred = true;
		CompletableFuture<Void> reconciled = remoteEntries(Entry.of(id1), Entry.of(id3));

		assertEquals(List.of(Entry.of(id1), Entry.of(id3)), store.snapshot().list(ENTRIES));
		assertFalse(elementSet.has(id3));
		assertEquals(1, elementSet.size());
		assertEquals(List.of(element(id1)), elementSet.elements());
		assertEquals(Optional.empty(), elementSet.group(id3));

		factory.release(id3);
		reconciled.join();
		assertEquals(List.of(element(id1), element(id3)), elementSet.elements());
	}

	@Test
	void removalAndRegroupOfUnhydratedEntries_publishNothing() {
		remoteEntries(Entry.of(id1)).join();
		recorder.restart();

		elementSet.reconcile(
			List.of(Entry.of(id1), new Entry(id2, "b")),
			List.of(Entry.of(id1), new Entry(id2, "a"), Entry.of(id3))
		).join();
		assertEquals(emptyList(), recorder.events());
		assertEquals(List.of(element(id1)), elementSet.elements());
	}

	@Test
	void hydrationFailure_noChangesNoEvents() {
		setLogging(Level.OFF, LocalStore.class);
		remoteEntries(Entry.of(id2)).join();
		recorder.restart();
		RuntimeException failure = new IllegalStateException("Can't load");
		factory.failures.put(id1, failure);

		CompletionException e = assertThrows(CompletionException.class, () -> remoteEntries(Entry.of(id1), Entry.of(id3)).join());
		assertThat(e.getCause(), instanceOf(HydrationFailureException.class));
		HydrationFailureException hydrationFailure = (HydrationFailureException) e.getCause();
		assertEquals(id1, hydrationFailure.elementID());
		assertSame(failure, hydrationFailure.getCause());

		assertTrue(elementSet.has(id2));
		assertFalse(elementSet.has(id1));
		assertFalse(elementSet.has(id3));
		assertEquals(emptyList(), recorder.events());
	}

	@Test
	void hydrationFailure_laterDiffRetries() {
		setLogging(Level.OFF, LocalStore.class);
		factory.failures.put(id1, new IllegalStateException("Can't load"));
		assertThrows(CompletionException.class, () -> remoteEntries(Entry.of(id1)).join());

		factory.failures.clear();
		remoteEntries().join();
		remoteEntries(Entry.of(id1)).join();
		assertTrue(elementSet.has(id1));
	}

	@Test
	void liveStore_activatesNewElements() {
		store.synch(true).join();
		remoteEntries(Entry.of(id1)).join();
		TestElement e1 = element(id1);
		assertTrue(e1.live());
		assertThat(e1.synchCalls(), contains(true));
	}

	@Test
	void idleStore_leavesNewElementsIdle() {
		remoteEntries(Entry.of(id1)).join();
		TestElement e1 = element(id1);
		assertFalse(e1.live());
		assertEquals(emptyList(), e1.synchCalls());
	}

	@Test
	void loadElements_hydratesEverythingWithOneEvent() {
		elementSet.close();
		store.receiveRemote(s -> s.with(ENTRIES, List.of(new Entry(id1, "a"), Entry.of(id2)))).join();
		ElementSet<TestElement> opened = new ElementSet<>(bus, store, cache);
		tearDownActions.addFirst(opened::close);
		recorder.restart();
		store.synch(true).join();

		opened.loadElements().join();
		assertEquals(List.of(ElementSetEvent.<TestElement>loadElements()), recorder.events());
		assertEquals(LOAD_ELEMENTS.eventName(), recorder.eventNames().get(0));
		assertEquals(List.of(element(id1), element(id2)), opened.elements());
		assertEquals(List.of(element(id1)), opened.elements("a"));
		assertTrue(element(id1).live());
		assertTrue(element(id2).live());
	}

	@Test
	void loadElements_aliases() {
		remoteEntries(Entry.of(id1)).join();
		recorder.restart();
		elementSet.load().join();
		elementSet.create().join();
		assertEquals(List.of("loadelements", "loadelements"), recorder.eventNames());
		assertEquals(1, elementSet.size());
	}

	@Test
	void loadElements_failureLeavesIndexUntouched() {
		elementSet.close();
		store.receiveRemote(s -> s.with(ENTRIES, List.of(Entry.of(id1), Entry.of(id2)))).join();
		ElementSet<TestElement> opened = new ElementSet<>(bus, store, cache);
		tearDownActions.addFirst(opened::close);
		factory.failures.put(id2, new IllegalStateException("Can't load"));

		CompletionException e = assertThrows(CompletionException.class, () -> opened.loadElements().join());
		assertThat(e.getCause(), instanceOf(HydrationFailureException.class));
		assertEquals(0, opened.size());
		assertEquals(emptyList(), recorder.events());
	}

	@Test
	void loadElements_loadsConcurrently() {
		elementSet.close();
		store.receiveRemote(s -> s.with(ENTRIES, List.of(Entry.of(id1), Entry.of(id2)))).join();
		ElementSet<TestElement> opened = new ElementSet<>(bus, store, cache);
		tearDownActions.addFirst(opened::close);
		factory.deferred = true;

		CompletableFuture<Void> loading = opened.loadElements();
		assertTrue(factory.isWaitingFor(id1));
		assertTrue(factory.isWaitingFor(id2), "Loads shouldn't wait for each other");
		factory.release(id2);
		assertEquals(0, opened.size(), "Nothing should be inserted until everything is loaded");
		factory.release(id1);
		loading.join();
		assertEquals(2, opened.size());
	}

	@Test
	void remoteAdditions_hydrateConcurrently() {
		factory.deferred = true;
		CompletableFuture<Void> reconciled = remoteEntries(Entry.of(id1), Entry.of(id2), Entry.of(id3));
		assertThat(factory.requests, containsInAnyOrder(id1, id2, id3));
		factory.release(id3);
		factory.release(id1);
		factory.release(id2);
		reconciled.join();
		assertEquals(List.of("add", "remoteadd", "add", "remoteadd", "add", "remoteadd"), recorder.eventNames());
		assertEquals(3, elementSet.size());
	}

	@Test
	void afterClose_remoteChangesIgnored() {
		elementSet.close();
		remoteEntries(Entry.of(id1)).join();
		assertFalse(elementSet.has(id1));
		assertEquals(emptyList(), recorder.events());
		assertEquals(emptyList(), factory.requests);
	}
}
