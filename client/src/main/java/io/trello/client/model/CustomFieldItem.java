package io.trello.client.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasOne;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import org.jspecify.annotations.Nullable;

/**
 * The value of a {@link CustomField} on one card. Set it through
 * {@link Card#setCustomFieldValue} or {@link Card#setCustomFieldOption}.
 */
public class CustomFieldItem extends BasicData {

    public static final HasOne<CustomField> CUSTOM_FIELD = AssociationBuilder.hasOne("customField", () -> CustomField.TYPE)
            .path("/customFields/{idCustomField}")
            .build();

    public static final EntityType<CustomFieldItem> TYPE = EntityType.builder(CustomFieldItem.class, CustomFieldItem::new)
            .schema(Schema.builder()
                    .readonly("idCustomField", "idModel", "modelType", "value", "idValue")
                    .build())
            .associations(CUSTOM_FIELD)
            .build();

    public CustomFieldItem(TrelloClient client) {
        super(client, TYPE);
    }

    public @Nullable String getCustomFieldId() {
        return getString("idCustomField");
    }

    /**
     * @return the card id
     */
    public @Nullable String getModelId() {
        return getString("idModel");
    }

    /**
     * @return e.g. {@code {"text":"hello"}}, {@link MissingNode} for list fields
     */
    public JsonNode getValue() {
        JsonNode value = getAttribute("value");
        return value == null ? MissingNode.getInstance() : value;
    }

    /**
     * @return the selected option of a list field
     */
    public @Nullable String getOptionId() {
        return getString("idValue");
    }

    public CustomField customField() {
        return one(CUSTOM_FIELD).orElseThrow();
    }
}
