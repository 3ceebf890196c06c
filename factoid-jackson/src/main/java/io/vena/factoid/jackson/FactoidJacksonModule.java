package io.vena.factoid.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;
import io.vena.factoid.Entry;
import io.vena.factoid.Identifier;
import java.io.IOException;
import org.jetbrains.annotations.Nullable;

import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.FIELD_NAME;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.VALUE_NULL;

/**
 * Teaches Jackson the wire format of the replicated membership state.
 *
 * <ul><li>
 * An {@link Identifier} is a JSON string.
 * </li><li>
 * An {@link Entry} is an object <code>{"id": ..., "group": ...}</code>.
 * The <code>group</code> field is omitted when the entry has no group,
 * and a missing, null or empty <code>group</code> reads as no group.
 * </li></ul>
 */
public final class FactoidJacksonModule extends Module {
	static final String ID_FIELD = "id";
	static final String GROUP_FIELD = "group";

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new FactoidSerializers());
		context.addDeserializers(new FactoidDeserializers());
	}

	private static final class FactoidSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Identifier.class.isAssignableFrom(theClass)) {
				return identifierSerializer();
			} else if (Entry.class.isAssignableFrom(theClass)) {
				return entrySerializer();
			} else {
				return null;
			}
		}

		private JsonSerializer<Identifier> identifierSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(Identifier value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeString(value.toString());
				}
			};
		}

		private JsonSerializer<Entry> entrySerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(Entry value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeStartObject();
					gen.writeStringField(ID_FIELD, value.id().toString());
					if (value.hasGroup()) {
						gen.writeStringField(GROUP_FIELD, value.group());
					}
					gen.writeEndObject();
				}
			};
		}
	}

	private static final class FactoidDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Identifier.class.isAssignableFrom(theClass)) {
				return identifierDeserializer();
			} else if (Entry.class.isAssignableFrom(theClass)) {
				return entryDeserializer();
			} else {
				return null;
			}
		}

		private JsonDeserializer<Identifier> identifierDeserializer() {
			return new JsonDeserializer<>() {
				@Override
				public Identifier deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					return identifier(p.getValueAsString(), ctxt);
				}
			};
		}

		private JsonDeserializer<Entry> entryDeserializer() {
			return new JsonDeserializer<>() {
				@Override
				public Entry deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					if (p.currentToken() != START_OBJECT) {
						return ctxt.reportInputMismatch(Entry.class, "Expected an object for Entry; found %s", p.currentToken());
					}
					Identifier id = null;
					String group = null;
					for (JsonToken token = p.nextToken(); token != END_OBJECT; token = p.nextToken()) {
						if (token != FIELD_NAME) {
							return ctxt.reportInputMismatch(Entry.class, "Unexpected token in Entry: %s", token);
						}
						String fieldName = p.currentName();
						JsonToken valueToken = p.nextToken();
						switch (fieldName) {
							case ID_FIELD -> id = identifier(p.getValueAsString(), ctxt);
							case GROUP_FIELD -> group = (valueToken == VALUE_NULL) ? null : p.getValueAsString();
							default -> {
								return ctxt.reportInputMismatch(Entry.class, "Unexpected field in Entry: \"%s\"", fieldName);
							}
						}
					}
					if (id == null) {
						return ctxt.reportInputMismatch(Entry.class, "Entry is missing \"%s\"", ID_FIELD);
					}
					return Entry.of(id, group);
				}
			};
		}

		private static Identifier identifier(@Nullable String text, DeserializationContext ctxt) throws IOException {
			if (text == null) {
				return ctxt.reportInputMismatch(Identifier.class, "Expected a string for Identifier");
			}
			try {
				return Identifier.from(text);
			} catch (IllegalArgumentException e) {
				throw ctxt.weirdStringException(text, Identifier.class, e.getMessage());
			}
		}
	}
}
