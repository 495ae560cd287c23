package io.trello.client.model;

import java.time.Instant;
import java.util.Optional;

import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasOne;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import org.jspecify.annotations.Nullable;

/**
 * A file or link attached to a card. Attachments are added and removed through
 * {@link Card#addAttachment} and {@link Card#removeAttachment}.
 */
public class Attachment extends BasicData {

    public static final HasOne<Member> MEMBER = AssociationBuilder.hasOne("member", () -> Member.TYPE)
            .path("/members/{idMember}")
            .optional()
            .build();

    public static final EntityType<Attachment> TYPE = EntityType.builder(Attachment.class, Attachment::new)
            .schema(Schema.builder()
                    .readonly("name", "url", "bytes", "date", "idMember", "isUpload", "mimeType", "pos", "previews")
                    .build())
            .associations(MEMBER)
            .build();

    public Attachment(TrelloClient client) {
        super(client, TYPE);
    }

    public @Nullable String getName() {
        return getString("name");
    }

    public @Nullable String getUrl() {
        return getString("url");
    }

    /**
     * @return the size of an uploaded file, null for links
     */
    public @Nullable Long getBytes() {
        Double bytes = getDouble("bytes");
        return bytes == null ? null : bytes.longValue();
    }

    public @Nullable Instant getDate() {
        return getInstant("date");
    }

    public @Nullable String getMimeType() {
        return getString("mimeType");
    }

    public boolean isUpload() {
        return Boolean.TRUE.equals(getBoolean("isUpload"));
    }

    public @Nullable String getMemberId() {
        return getString("idMember");
    }

    /**
     * @return the member who attached it
     */
    public Optional<Member> member() {
        return one(MEMBER);
    }
}
