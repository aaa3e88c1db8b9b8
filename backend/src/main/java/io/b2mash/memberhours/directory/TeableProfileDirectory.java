package io.b2mash.memberhours.directory;

import io.b2mash.memberhours.config.MemberHoursConfig.DirectoryProperties;
import io.b2mash.memberhours.credential.EmailAddresses;
import io.b2mash.memberhours.exception.DirectoryUnavailableException;
import io.b2mash.memberhours.exception.NoSuchProfileException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * {@link ProfileDirectory} backed by the members table of a Teable base. Every read is retried
 * once when the directory is unavailable; a second failure propagates.
 */
@Component
public class TeableProfileDirectory implements ProfileDirectory {

  private static final Logger log = LoggerFactory.getLogger(TeableProfileDirectory.class);

  static final String FIELD_FIRST_NAME = "Vorname";
  static final String FIELD_LAST_NAME = "Nachname";
  static final String FIELD_EMAIL = "Email";
  static final String FIELD_FAMILY = "Familie";
  static final String FIELD_BIRTH_DATE = "Geburtsdatum";
  private static final Object[] PROJECTION = {
    FIELD_FIRST_NAME, FIELD_LAST_NAME, FIELD_EMAIL, FIELD_FAMILY, FIELD_BIRTH_DATE
  };

  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final String membersTableId;

  @Autowired
  public TeableProfileDirectory(DirectoryProperties properties, ObjectMapper objectMapper) {
    this(RestClient.builder().requestFactory(requestFactory(properties)), properties, objectMapper);
  }

  TeableProfileDirectory(
      RestClient.Builder builder, DirectoryProperties properties, ObjectMapper objectMapper) {
    this.restClient =
        builder
            .baseUrl(properties.baseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
    this.objectMapper = objectMapper;
    this.membersTableId = properties.membersTableId();
  }

  /** Wire shape of a single Teable record. */
  record TeableRecord(String id, Map<String, Object> fields) {}

  /** Wire shape of a Teable record listing. */
  record TeableRecordList(List<TeableRecord> records) {}

  @Override
  public List<ProfileRecord> resolve(String email) {
    String normalized = EmailAddresses.normalize(email);
    var listing = withRetry("resolve", () -> queryByField(FIELD_EMAIL, normalized));

    var profiles = new ArrayList<ProfileRecord>();
    for (var record : listing) {
      var profile = toProfile(record);
      // the server-side filter may be case-sensitive; the comparison here is authoritative
      if (EmailAddresses.normalize(profile.email()).equals(normalized)) {
        profiles.add(profile);
      }
    }
    if (profiles.isEmpty()) {
      throw new NoSuchProfileException("No member registered for this email");
    }
    log.debug("Resolved {} profile(s) for email lookup", profiles.size());
    return List.copyOf(profiles);
  }

  @Override
  public ProfileRecord findById(String profileId) {
    return withRetry("findById", () -> fetchRecord(profileId));
  }

  @Override
  public FamilyUnit familyOf(String profileId) {
    var profile = findById(profileId);
    if (!profile.hasFamily()) {
      return FamilyUnit.single(profile);
    }

    var listing =
        withRetry("familyOf", () -> queryByField(FIELD_FAMILY, profile.familyUnitId()));
    var members = new LinkedHashMap<String, ProfileRecord>();
    for (var record : listing) {
      var member = toProfile(record);
      if (profile.familyUnitId().equals(member.familyUnitId())) {
        members.putIfAbsent(member.profileId(), member);
      }
    }
    members.putIfAbsent(profile.profileId(), profile);
    return new FamilyUnit(profile.familyUnitId(), new ArrayList<>(members.values()));
  }

  private List<TeableRecord> queryByField(String field, String value) {
    String filter = filterJson(field, value);
    try {
      var response =
          restClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path("/table/{tableId}/record")
                          .queryParam("filter", "{filter}")
                          .queryParam("projection[]", PROJECTION)
                          .build(membersTableId, filter))
              .retrieve()
              .body(TeableRecordList.class);
      if (response == null || response.records() == null) {
        throw new DirectoryUnavailableException("Member directory returned an unexpected response");
      }
      return response.records();
    } catch (RestClientException e) {
      log.warn("Teable query on {} failed: {}", field, e.getMessage());
      throw new DirectoryUnavailableException("Member directory is currently unavailable");
    }
  }

  private ProfileRecord fetchRecord(String profileId) {
    try {
      var record =
          restClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path("/table/{tableId}/record/{recordId}")
                          .queryParam("projection[]", PROJECTION)
                          .build(membersTableId, profileId))
              .retrieve()
              .body(TeableRecord.class);
      if (record == null || record.fields() == null) {
        throw new NoSuchProfileException("No member found with id " + profileId);
      }
      return toProfile(record);
    } catch (HttpClientErrorException.NotFound e) {
      throw new NoSuchProfileException("No member found with id " + profileId);
    } catch (RestClientException e) {
      log.warn("Teable record lookup failed: {}", e.getMessage());
      throw new DirectoryUnavailableException("Member directory is currently unavailable");
    }
  }

  private <T> T withRetry(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (DirectoryUnavailableException first) {
      log.warn("Directory {} failed, retrying once", operation);
      return call.get();
    }
  }

  private String filterJson(String field, String value) {
    var condition = new LinkedHashMap<String, Object>();
    condition.put("fieldId", field);
    condition.put("operator", "is");
    condition.put("value", value);
    var filter = new LinkedHashMap<String, Object>();
    filter.put("conjunction", "and");
    filter.put("filterSet", List.of(condition));
    try {
      return objectMapper.writeValueAsString(filter);
    } catch (JacksonException e) {
      throw new IllegalStateException("Failed to serialize directory filter", e);
    }
  }

  static ProfileRecord toProfile(TeableRecord record) {
    var fields = record.fields();
    return new ProfileRecord(
        record.id(),
        stringField(fields, FIELD_FIRST_NAME),
        stringField(fields, FIELD_LAST_NAME),
        stringField(fields, FIELD_EMAIL),
        familyId(fields.get(FIELD_FAMILY)),
        parseBirthDate(stringField(fields, FIELD_BIRTH_DATE)));
  }

  private static String stringField(Map<String, Object> fields, String name) {
    Object value = fields.get(name);
    return value instanceof String text ? text.trim() : "";
  }

  /** Family ids arrive as text or as integral numbers depending on the column type. */
  private static String familyId(Object value) {
    if (value instanceof String text) {
      return text.isBlank() ? null : text.trim();
    }
    if (value instanceof Number number) {
      return String.valueOf(number.longValue());
    }
    return null;
  }

  /** Accepts plain ISO dates as well as ISO timestamps; anything else is treated as unknown. */
  static LocalDate parseBirthDate(String value) {
    if (value == null || value.length() < 10) {
      return null;
    }
    try {
      return LocalDate.parse(value.substring(0, 10));
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static SimpleClientHttpRequestFactory requestFactory(DirectoryProperties properties) {
    var factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(properties.connectTimeout());
    factory.setReadTimeout(properties.readTimeout());
    return factory;
  }
}
