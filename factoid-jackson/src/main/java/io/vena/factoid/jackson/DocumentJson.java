package io.vena.factoid.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.factoid.ElementSet;
import io.vena.factoid.Entry;
import io.vena.factoid.Identifier;
import io.vena.factoid.document.FactoidDocument;
import io.vena.factoid.store.LocalStore;
import io.vena.factoid.store.ReplicatedStore;
import io.vena.factoid.store.StoreSnapshot;
import java.util.List;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The JSON view of a {@link FactoidDocument}, as served to clients that fetch a whole document.
 *
 * <p>
 * The view carries the document's own fields and its element <em>entries</em>, not the elements
 * themselves: each element has its own replicated state. Reading a view back gives a
 * {@link StoreSnapshot} from which a new {@link LocalStore} can be seeded, after which
 * {@link FactoidDocument#load()} hydrates the elements.
 */
public final class DocumentJson {
	private final ObjectMapper mapper;

	public DocumentJson() {
		this(new ObjectMapper());
	}

	/**
	 * @param mapper is copied, so the caller's configuration is unaffected
	 */
	public DocumentJson(@NonNull ObjectMapper mapper) {
		this.mapper = mapper.copy().registerModule(new FactoidJacksonModule());
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record DocumentView(
		@NonNull Identifier id,
		@Nullable String name,
		List<Identifier> organisms,
		List<Entry> entries
	) {
		public DocumentView {
			organisms = (organisms == null) ? List.of() : List.copyOf(organisms);
			entries = (entries == null) ? List.of() : List.copyOf(entries);
		}
	}

	public static DocumentView view(FactoidDocument<?> document) {
		ReplicatedStore store = document.store();
		return new DocumentView(
			document.id(),
			document.name(),
			document.toggledOrganisms(),
			store.snapshot().list(ElementSet.ENTRIES));
	}

	public JsonNode json(FactoidDocument<?> document) {
		return mapper.valueToTree(view(document));
	}

	public String toJson(FactoidDocument<?> document) throws JsonProcessingException {
		return mapper.writeValueAsString(view(document));
	}

	public DocumentView fromJson(String json) throws JsonProcessingException {
		DocumentView result = mapper.readValue(json, DocumentView.class);
		LOGGER.debug("Read document {} with {} entries", result.id(), result.entries().size());
		return result;
	}

	/**
	 * @return the store state of a document matching <code>view</code>
	 * @throws io.vena.factoid.exceptions.InvariantViolationException if two entries have the same id
	 */
	public static StoreSnapshot toSnapshot(DocumentView view) {
		StoreSnapshot result = FactoidDocument.initialState(view.id(), view.name())
			.with(FactoidDocument.ORGANISMS, view.organisms())
			.with(ElementSet.ENTRIES, view.entries());
		LOGGER.trace("Snapshot of {}: {}", view.id(), result);
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentJson.class);
}
