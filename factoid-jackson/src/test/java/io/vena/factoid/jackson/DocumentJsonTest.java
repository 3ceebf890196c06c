package io.vena.factoid.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.factoid.Element;
import io.vena.factoid.Entry;
import io.vena.factoid.EventBus;
import io.vena.factoid.FactoidEvent;
import io.vena.factoid.FactoryElementCache;
import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import io.vena.factoid.MutationOptions;
import io.vena.factoid.document.FactoidDocument;
import io.vena.factoid.exceptions.InvariantViolationException;
import io.vena.factoid.jackson.DocumentJson.DocumentView;
import io.vena.factoid.store.LocalStore;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentJsonTest {
	static final Identifier docID = Identifier.from("doc1");
	static final Identifier human = Identifier.from("9606");
	static final Identifier p53 = Identifier.from("p53");
	static final Identifier mdm2 = Identifier.from("mdm2");

	DocumentJson documentJson;
	FactoryElementCache<Protein> cache;
	FactoidDocument<Protein> document;

	@BeforeEach
	void setUp() {
		documentJson = new DocumentJson();
		cache = new FactoryElementCache<>(id -> completedFuture(new Protein(id)));
		document = newDocument(new LocalStore("original", FactoidDocument.initialState(docID, "p53 regulation")));
	}

	@AfterEach
	void tearDown() {
		document.close();
	}

	@Test
	void json_hasDocumentFieldsAndEntries() throws Exception {
		document.add(new Protein(p53)).join();
		document.add(new Protein(mdm2), MutationOptions.inGroup("complex")).join();
		document.toggleOrganism(human).join();

		JsonNode expected = new ObjectMapper().readTree("""
			{
				"id": "doc1",
				"name": "p53 regulation",
				"organisms": [ "9606" ],
				"entries": [
					{ "id": "p53" },
					{ "id": "mdm2", "group": "complex" }
				]
			}""");
		assertEquals(expected, documentJson.json(document));
	}

	@Test
	void unnamedDocument_omitsName() {
		try (FactoidDocument<Protein> unnamed = newDocument(new LocalStore("unnamed", FactoidDocument.initialState(docID, null)))) {
			JsonNode json = documentJson.json(unnamed);
			assertFalse(json.has("name"));
		}
	}

	@Test
	void roundTrip_seedsEquivalentDocument() throws Exception {
		document.add(new Protein(p53)).join();
		document.add(new Protein(mdm2), MutationOptions.inGroup("complex")).join();
		document.toggleOrganism(human).join();

		DocumentView view = documentJson.fromJson(documentJson.toJson(document));
		assertEquals(DocumentJson.view(document), view);

		try (FactoidDocument<Protein> copy = newDocument(new LocalStore("copy", DocumentJson.toSnapshot(view)))) {
			assertEquals(0, copy.size(), "Elements are not hydrated until the document is loaded");
			copy.load().join();
			assertEquals(document.id(), copy.id());
			assertEquals(document.name(), copy.name());
			assertEquals(document.toggledOrganisms(), copy.toggledOrganisms());
			assertEquals(ids(document.elements()), ids(copy.elements()));
			assertEquals(List.of(copy.get(mdm2).orElseThrow()), copy.elements("complex"));
		}
	}

	@Test
	void missingOptionalFields_readAsEmpty() throws Exception {
		DocumentView view = documentJson.fromJson("{\"id\":\"doc2\"}");
		assertEquals(Identifier.from("doc2"), view.id());
		assertNull(view.name());
		assertEquals(List.of(), view.organisms());
		assertEquals(List.of(), view.entries());
	}

	@Test
	void duplicateEntries_rejected() throws Exception {
		DocumentView view = documentJson.fromJson("""
			{ "id": "doc1", "entries": [ { "id": "p53" }, { "id": "p53", "group": "g" } ] }""");
		assertEquals(List.of(Entry.of(p53), Entry.of(p53, "g")), view.entries());
		assertThrows(InvariantViolationException.class, () -> DocumentJson.toSnapshot(view));
	}

	private FactoidDocument<Protein> newDocument(LocalStore store) {
		return new FactoidDocument<>(new EventBus<FactoidEvent>(store.name()), store, cache);
	}

	private static List<Identifier> ids(List<? extends Identified> items) {
		return items.stream().map(Identified::id).toList();
	}

	record Protein(Identifier id) implements Element {
		@Override
		public boolean live() {
			return false;
		}

		@Override
		public CompletableFuture<Void> synch(boolean enable) {
			return completedFuture(null);
		}
	}
}
