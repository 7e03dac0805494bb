// Copyright (c) 2007-2023 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// This software, the RabbitMQ Java client library, is triple-licensed under the
// Mozilla Public License 2.0 ("MPL"), the GNU General Public License version 2
// ("GPL") and the Apache License version 2 ("ASL"). For the MPL, please see
// LICENSE-MPL-RabbitMQ. For the GPL, please see LICENSE-GPL2.  For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.sqsbench.perf.gateway;

import static java.lang.Math.min;
import static java.util.stream.Collectors.toList;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;
import software.amazon.awssdk.services.sqs.model.BatchResultErrorEntry;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResultEntry;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.DeleteQueueRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

/** {@link QueueGateway} for Amazon SQS, on top of the AWS SDK synchronous client. */
public class SqsQueueGateway implements QueueGateway {

  private static final Logger LOGGER = LoggerFactory.getLogger(SqsQueueGateway.class);

  static final String NUMBER_DATA_TYPE = "Number";
  static final String ALL_MESSAGE_ATTRIBUTES = "All";

  private final SqsClient client;
  private final int receiveWaitTimeInSeconds;

  public SqsQueueGateway(SqsClient client, int receiveWaitTimeInSeconds) {
    this.client = client;
    this.receiveWaitTimeInSeconds = receiveWaitTimeInSeconds;
  }

  public static SqsQueueGateway create(GatewayConfiguration configuration) {
    LOGGER.debug("Creating SQS client with {}", configuration);
    SqsClientBuilder builder = SqsClient.builder().region(Region.of(configuration.getRegion()));
    if (configuration.getProfile() == null) {
      builder.credentialsProvider(DefaultCredentialsProvider.create());
    } else {
      builder.credentialsProvider(ProfileCredentialsProvider.create(configuration.getProfile()));
    }
    if (configuration.getEndpoint() != null) {
      builder.endpointOverride(URI.create(configuration.getEndpoint()));
    }
    return new SqsQueueGateway(builder.build(), configuration.getReceiveWaitTimeInSeconds());
  }

  @Override
  public String ensureQueue(String name) {
    try {
      String queueUrl =
          client.getQueueUrl(GetQueueUrlRequest.builder().queueName(name).build()).queueUrl();
      LOGGER.info("Queue already exists: {}", queueUrl);
      return queueUrl;
    } catch (QueueDoesNotExistException e) {
      LOGGER.debug("Queue {} does not exist, creating it", name);
    } catch (SdkException e) {
      LOGGER.warn("Could not look up queue {}, trying to create it: {}", name, e.getMessage());
    }
    try {
      String queueUrl =
          client.createQueue(CreateQueueRequest.builder().queueName(name).build()).queueUrl();
      LOGGER.info("Successfully created new queue: {}", queueUrl);
      return queueUrl;
    } catch (SdkException e) {
      throw new QueueGatewayException("Could not create queue " + name, e);
    }
  }

  @Override
  public String send(String queue, byte[] body, MessageMetadata metadata) {
    Map<String, MessageAttributeValue> attributes = new LinkedHashMap<>();
    metadata
        .toAttributes()
        .forEach(
            (key, value) ->
                attributes.put(
                    key,
                    MessageAttributeValue.builder()
                        .dataType(NUMBER_DATA_TYPE)
                        .stringValue(value)
                        .build()));
    try {
      return client
          .sendMessage(
              SendMessageRequest.builder()
                  .queueUrl(queue)
                  .messageBody(new String(body, StandardCharsets.UTF_8))
                  .messageAttributes(attributes)
                  .build())
          .messageId();
    } catch (SdkException e) {
      throw new QueueGatewayException("Error while sending message " + metadata.getIndex(), e);
    }
  }

  @Override
  public Optional<InboundMessage> receiveOne(String queue, int visibilityTimeoutInSeconds) {
    List<InboundMessage> messages = receive(queue, 1, visibilityTimeoutInSeconds);
    return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(0));
  }

  @Override
  public List<InboundMessage> receiveBatch(
      String queue, int maxCount, int visibilityTimeoutInSeconds) {
    if (maxCount <= 0) {
      throw new IllegalArgumentException("Batch size must be positive: " + maxCount);
    }
    return receive(queue, min(maxCount, MAX_BATCH_SIZE), visibilityTimeoutInSeconds);
  }

  private List<InboundMessage> receive(
      String queue, int maxCount, int visibilityTimeoutInSeconds) {
    List<Message> messages;
    try {
      messages =
          client
              .receiveMessage(
                  ReceiveMessageRequest.builder()
                      .queueUrl(queue)
                      .maxNumberOfMessages(maxCount)
                      .visibilityTimeout(visibilityTimeoutInSeconds)
                      .waitTimeSeconds(receiveWaitTimeInSeconds)
                      .messageAttributeNames(ALL_MESSAGE_ATTRIBUTES)
                      .build())
              .messages();
    } catch (SdkException e) {
      throw new QueueGatewayException("Error while receiving messages", e);
    }
    if (messages == null || messages.isEmpty()) {
      return Collections.emptyList();
    }
    return messages.stream().limit(maxCount).map(SqsQueueGateway::toInbound).collect(toList());
  }

  static InboundMessage toInbound(Message message) {
    Map<String, String> attributes = new LinkedHashMap<>();
    message
        .messageAttributes()
        .forEach(
            (key, value) -> {
              if (value.stringValue() != null) {
                attributes.put(key, value.stringValue());
              }
            });
    String body = message.body();
    return new InboundMessage(
        message.messageId(),
        body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8),
        MessageMetadata.fromAttributes(attributes),
        message.receiptHandle());
  }

  @Override
  public void acknowledge(String queue, String acknowledgmentToken) {
    try {
      client.deleteMessage(
          DeleteMessageRequest.builder().queueUrl(queue).receiptHandle(acknowledgmentToken).build());
    } catch (SdkException e) {
      throw new QueueGatewayException("Error while deleting message", e);
    }
  }

  @Override
  public BatchAcknowledgement acknowledgeBatch(String queue, List<String> acknowledgmentTokens) {
    if (acknowledgmentTokens.isEmpty()) {
      return BatchAcknowledgement.EMPTY;
    }
    List<String> acknowledged = new ArrayList<>(acknowledgmentTokens.size());
    Map<String, String> failed = new LinkedHashMap<>();
    // a delete batch request accepts at most 10 entries
    for (int offset = 0; offset < acknowledgmentTokens.size(); offset += MAX_BATCH_SIZE) {
      List<String> tokens =
          acknowledgmentTokens.subList(
              offset, min(offset + MAX_BATCH_SIZE, acknowledgmentTokens.size()));
      List<DeleteMessageBatchRequestEntry> entries = new ArrayList<>(tokens.size());
      for (int i = 0; i < tokens.size(); i++) {
        entries.add(
            DeleteMessageBatchRequestEntry.builder()
                .id(String.valueOf(i))
                .receiptHandle(tokens.get(i))
                .build());
      }
      DeleteMessageBatchResponse response;
      try {
        response =
            client.deleteMessageBatch(
                DeleteMessageBatchRequest.builder().queueUrl(queue).entries(entries).build());
      } catch (SdkException e) {
        throw new QueueGatewayException("Error while deleting batch of messages", e);
      }
      for (DeleteMessageBatchResultEntry entry : response.successful()) {
        acknowledged.add(tokens.get(Integer.parseInt(entry.id())));
      }
      for (BatchResultErrorEntry entry : response.failed()) {
        failed.put(
            tokens.get(Integer.parseInt(entry.id())), entry.code() + " (" + entry.message() + ")");
      }
    }
    return new BatchAcknowledgement(acknowledged, failed);
  }

  @Override
  public void deleteQueue(String queue) {
    try {
      client.deleteQueue(DeleteQueueRequest.builder().queueUrl(queue).build());
    } catch (SdkException e) {
      throw new QueueGatewayException("Could not delete queue " + queue, e);
    }
  }

  @Override
  public List<String> listQueues() {
    try {
      return new ArrayList<>(client.listQueues().queueUrls());
    } catch (SdkException e) {
      throw new QueueGatewayException("Could not list queues", e);
    }
  }

  @Override
  public void close() {
    client.close();
  }
}
