package io.trello.client.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasOne;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import org.jspecify.annotations.Nullable;

/**
 * A field definition on a board. The values live on cards as {@link CustomFieldItem}s.
 */
public class CustomField extends BasicData {

    public static final HasOne<Board> BOARD = AssociationBuilder.hasOne("board", () -> Board.TYPE)
            .path("/boards/{idModel}")
            .build();

    public static final EntityType<CustomField> TYPE = EntityType.builder(CustomField.class, CustomField::new)
            .path("/customFields")
            .schema(Schema.builder()
                    .attribute("name", "pos", "display")
                    .createOnly("idModel", "modelType", "type")
                    .readonly("options", "fieldGroup")
                    .build())
            .associations(BOARD)
            .build();

    /**
     * A choice of a {@code list} field.
     */
    public record Option(String id, String text, @Nullable String color, double pos) {
    }

    public CustomField(TrelloClient client) {
        super(client, TYPE);
    }

    public static CustomField find(TrelloClient client, String id) {
        return client.find(TYPE, id);
    }

    public @Nullable String getName() {
        return getString("name");
    }

    public void setName(String name) {
        setAttribute("name", name);
    }

    /**
     * @return {@code text}, {@code number}, {@code date}, {@code checkbox} or {@code list}
     */
    public @Nullable String getFieldType() {
        return getString("type");
    }

    public void setFieldType(String type) {
        setAttribute("type", type);
    }

    public @Nullable String getBoardId() {
        return getString("idModel");
    }

    public void setBoardId(String boardId) {
        setAttribute("idModel", boardId);
        setAttribute("modelType", "board");
    }

    public @Nullable Double getPosition() {
        return getDouble("pos");
    }

    public void setPosition(Object pos) {
        setAttribute("pos", pos);
    }

    public List<Option> getOptions() {
        JsonNode options = getAttribute("options");
        if (options == null || !options.isArray()) {
            return List.of();
        }
        List<Option> result = new ArrayList<>(options.size());
        for (JsonNode option : options) {
            JsonNode color = option.path("color");
            result.add(new Option(
                    option.path("id").asText(),
                    option.path("value").path("text").asText(),
                    color.isTextual() ? color.asText() : null,
                    option.path("pos").asDouble()));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @param text the option text
     * @return the option with that text, if the field has one
     */
    public Optional<Option> findOption(String text) {
        return getOptions().stream().filter(option -> option.text().equals(text)).findFirst();
    }

    public Board board() {
        return one(BOARD).orElseThrow();
    }
}
