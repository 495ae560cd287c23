package io.trello.client.association;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import io.trello.client.exception.NotSavedException;
import io.trello.client.net.QueryStrings;
import io.trello.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A named relationship from one entity type to another, declared once per entity class
 * and shared by all its instances.
 * <p>
 * The path template refers to attributes of the owning entity as {@code {name}}, for
 * example {@code /boards/{id}/cards} or {@code /lists/{idList}}. The values are taken
 * from the owner when the association is resolved.
 *
 * @param <T> the target entity class
 * @param <R> what resolving the association yields
 */
public abstract class Association<T extends BasicData, R> {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    private final String name;
    private final Supplier<EntityType<T>> target;
    private final String pathTemplate;
    private final Map<String, String> params;

    protected Association(String name, Supplier<EntityType<T>> target, String pathTemplate, Map<String, String> params) {
        this.name = Assert.checkNotBlankParam("name", name);
        this.target = Assert.checkNotNullParam("target", target);
        this.pathTemplate = Assert.checkNotBlankParam("pathTemplate", pathTemplate);
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public String getName() {
        return name;
    }

    /**
     * The target type is looked up on first use so that entity classes can refer to each
     * other from their static declarations.
     */
    public EntityType<T> getTarget() {
        return Assert.checkNotNullParam("target", target.get());
    }

    public String getPathTemplate() {
        return pathTemplate;
    }

    /**
     * @return the query parameters sent on every fetch
     */
    public Map<String, String> getParams() {
        return params;
    }

    /**
     * Fills in the path template from the owner's attributes.
     *
     * @param owner the owning entity
     * @return the path, or null if an attribute the template refers to is unset
     * @throws NotSavedException if the template refers to {@code {id}} and the owner has none
     */
    public @Nullable String resolvePath(BasicData owner) {
        Matcher matcher = PLACEHOLDER.matcher(pathTemplate);
        StringBuilder path = new StringBuilder();
        while (matcher.find()) {
            String attribute = matcher.group(1);
            String value = attributeValue(owner, attribute);
            if (value == null) {
                return null;
            }
            matcher.appendReplacement(path, Matcher.quoteReplacement(QueryStrings.encode(value)));
        }
        matcher.appendTail(path);
        return path.toString();
    }

    /**
     * Checks that the owner can be asked for this association at all.
     *
     * @param owner the owning entity
     * @throws NotSavedException if the template refers to {@code {id}} and the owner has none
     */
    public void checkOwner(BasicData owner) {
        if (owner.getId() == null && refersToId()) {
            throw notSaved(owner);
        }
    }

    private boolean refersToId() {
        Matcher matcher = PLACEHOLDER.matcher(pathTemplate);
        while (matcher.find()) {
            if (Schema.ID.equals(matcher.group(1))) {
                return true;
            }
        }
        return false;
    }

    private NotSavedException notSaved(BasicData owner) {
        return new NotSavedException("Cannot load " + name + " of a " + owner.getType().getName()
                + " that has not been saved");
    }

    private @Nullable String attributeValue(BasicData owner, String attribute) {
        if (Schema.ID.equals(attribute)) {
            String id = owner.getId();
            if (id == null) {
                throw notSaved(owner);
            }
            return id;
        }
        JsonNode value = owner.getAttribute(attribute);
        return value == null ? null : value.asText();
    }

    Map<String, String> mergeParams(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(params);
        merged.putAll(overrides);
        return merged;
    }

    /**
     * Fetches the association for {@code owner}. Callers cache the result; this method
     * always goes to the API.
     *
     * @param owner the owning entity
     * @return the resolved value
     */
    public abstract R resolve(BasicData owner);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + " " + pathTemplate + "]";
    }
}
