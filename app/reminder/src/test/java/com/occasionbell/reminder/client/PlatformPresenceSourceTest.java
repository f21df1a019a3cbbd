package com.occasionbell.reminder.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.occasionbell.reminder.config.PlatformClientProperties;
import com.occasionbell.reminder.config.ReminderProperties;
import java.net.ConnectException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class PlatformPresenceSourceTest {

  private static final String MEMBERS_URL = "http://platform.test/v1/groups/g-1/locations/vc-1/members";

  @Test
  void membersPresentReturnsMemberIds() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(MEMBERS_URL))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                "{\"location_ref\":\"vc-1\",\"member_ids\":[\"alice\",\"bob\",\"alice\"]}",
                MediaType.APPLICATION_JSON));

    assertThat(fixture.source.membersPresent("vc-1")).containsExactlyInAnyOrder("alice", "bob");
  }

  @Test
  void emptyLocationIsEmptySet() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(MEMBERS_URL))
        .andRespond(withSuccess("{\"member_ids\":[]}", MediaType.APPLICATION_JSON));

    assertThat(fixture.source.membersPresent("vc-1")).isEmpty();
  }

  @Test
  void deletedLocationMapsToNotFound() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(MEMBERS_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> fixture.source.membersPresent("vc-1"))
        .isInstanceOf(PlatformIntegrationException.class)
        .extracting(ex -> ((PlatformIntegrationException) ex).reason())
        .isEqualTo(PlatformIntegrationException.Reason.NOT_FOUND);
  }

  @Test
  void missingMemberListMapsToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(MEMBERS_URL))
        .andRespond(withSuccess("{\"location_ref\":\"vc-1\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.source.membersPresent("vc-1"))
        .isInstanceOf(PlatformIntegrationException.class)
        .extracting(ex -> ((PlatformIntegrationException) ex).reason())
        .isEqualTo(PlatformIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void connectionFailureMapsToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(MEMBERS_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertThatThrownBy(() -> fixture.source.membersPresent("vc-1"))
        .isInstanceOf(PlatformIntegrationException.class)
        .extracting(ex -> ((PlatformIntegrationException) ex).reason())
        .isEqualTo(PlatformIntegrationException.Reason.BAD_GATEWAY);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://platform.test").build();
    final PlatformClientProperties properties =
        new PlatformClientProperties(true, "http://platform.test", null, null, null, null);
    final ReminderProperties reminderProperties =
        new ReminderProperties(null, null, null, null, "g-1", null, null, null, 0, 0);
    return new ClientFixture(
        new PlatformPresenceSource(restClient, properties, reminderProperties), server);
  }

  private record ClientFixture(PlatformPresenceSource source, MockRestServiceServer server) {}
}
