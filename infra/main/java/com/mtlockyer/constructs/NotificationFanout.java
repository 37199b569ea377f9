package com.mtlockyer.constructs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awscdk.services.sns.Subscription;
import software.amazon.awscdk.services.sns.SubscriptionProtocol;
import software.amazon.awscdk.services.sns.Topic;
import software.constructs.Construct;

/**
 * SNS topic the function publishes results and errors to, with one email subscription per recipient.
 *
 * <p>Subscriptions are created directly rather than through {@code Topic.addSubscription}, which keys
 * them by address and rejects a repeated recipient. Here a recipient listed twice gets two subscriptions.
 * Each id is the address plus its occurrence count, so editing the list never renames the subscription
 * of an address that stays (a renamed subscription is replaced and has to be confirmed again).
 */
public class NotificationFanout implements ArnAddressable {

    private static final Logger logger = LogManager.getLogger(NotificationFanout.class);

    private static final Pattern RECIPIENT_DELIMITER = Pattern.compile("[,;]");

    public final Topic topic;
    public final List<String> recipients;
    public final List<Subscription> subscriptions;

    public NotificationFanout(final Construct scope, NotificationFanoutProps props) {
        this.topic = Topic.Builder.create(scope, props.idPrefix())
                .displayName(props.displayName())
                .build();

        this.recipients = parseRecipients(props.emailNotification());
        var created = new ArrayList<Subscription>();
        var occurrences = new HashMap<String, Integer>();
        for (String recipient : this.recipients) {
            int occurrence = occurrences.merge(recipient, 1, Integer::sum) - 1;
            // Always email-json: Gmail in particular spam-filters the plain text format
            created.add(Subscription.Builder.create(scope, subscriptionId(props.idPrefix(), recipient, occurrence))
                    .topic(this.topic)
                    .protocol(SubscriptionProtocol.EMAIL_JSON)
                    .endpoint(recipient)
                    .build());
        }
        this.subscriptions = Collections.unmodifiableList(created);

        if (this.recipients.isEmpty()) {
            logger.warn(
                    "No email recipients configured for topic {}, notifications will not be delivered",
                    props.idPrefix());
        } else {
            logger.info("Subscribed {} recipient(s) to topic {}", this.recipients.size(), props.idPrefix());
        }
    }

    static String subscriptionId(String idPrefix, String recipient, int occurrence) {
        return "%s-Subscription-%s#%d".formatted(idPrefix, recipient, occurrence);
    }

    /**
     * Split a recipient list on ',' and ';'. Order and duplicates are preserved; surrounding whitespace is
     * trimmed and empty tokens are dropped.
     *
     * @param emailNotification delimited recipients, may be null or empty
     * @return recipients in input order
     */
    public static List<String> parseRecipients(String emailNotification) {
        if (emailNotification == null || emailNotification.isBlank()) {
            return List.of();
        }
        return Arrays.stream(RECIPIENT_DELIMITER.split(emailNotification))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String arn() {
        return this.topic.getTopicArn();
    }
}
