package io.b2mash.b2b.reportscheduler.scheduledreport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.b2mash.b2b.reportscheduler.exception.EntityValidationException;
import io.b2mash.b2b.reportscheduler.testutil.TestCodeSets;
import io.b2mash.b2b.reportscheduler.validation.EntityValidationError;
import io.b2mash.b2b.reportscheduler.validation.ValidateMode;
import io.b2mash.b2b.reportscheduler.validation.ValidationErrorKind;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import tools.jackson.databind.json.JsonMapper;

class ScheduledReportValidationServiceTest {

  private static final String VALID_OPTIONS =
      "{\"frequency\":\"Weekly\",\"frequency_option\":{\"day_of_week\":\"Tue,Thu\"},"
          + "\"period\":\"4 Weeks\",\"period_option\":\"CAL F\"}";

  private static final String BI_MONTHLY_WITH_PERIOD =
      "{\"frequency\":\"Bi-Monthly\",\"period\":\"YTD\"}";

  private final ScheduledReportValidationService service =
      new ScheduledReportValidationService(
          new ScheduledReportValidatorFactory(
              TestCodeSets.enumSource(),
              new SchedulerOptionsDecoder(JsonMapper.builder().build())));

  @Test
  void validEntityHasNoErrors() {
    var result =
        service.validate(
            Map.of("name", "Ops digest", "scheduler_options", VALID_OPTIONS),
            ValidateMode.ON_CREATE);

    assertThat(result.valid()).isTrue();
    assertThat(result.errors()).isEmpty();
  }

  @Test
  void invalidEntityReportsErrors() {
    var result =
        service.validate(
            Map.of("scheduler_options", "{\"frequency\":\"Every now and then\"}"),
            ValidateMode.ON_CREATE);

    assertThat(result.valid()).isFalse();
    assertThat(result.errors())
        .extracting(EntityValidationError::field, EntityValidationError::kind)
        .containsExactly(
            tuple("scheduler_options.frequency", ValidationErrorKind.NOT_IN_ALLOWED_SET));
  }

  @Test
  void eachCallUsesAFreshValidator() {
    Map<String, Object> invalid = Map.of("scheduler_options", "garbage");

    var first = service.validate(invalid, ValidateMode.ON_CREATE);
    var second = service.validate(invalid, ValidateMode.ON_CREATE);

    assertThat(first.errors()).hasSize(1);
    assertThat(second.errors()).isEqualTo(first.errors());
  }

  @Test
  void modeIsPassedToValidator() {
    assertThat(service.validate(Map.of(), ValidateMode.ON_CREATE).valid()).isFalse();
    assertThat(service.validate(Map.of(), ValidateMode.ON_UPDATE).valid()).isTrue();
  }

  @Test
  void validateOrThrowPassesForValidEntity() {
    assertThatCode(
            () ->
                service.validateOrThrow(
                    Map.of("scheduler_options", VALID_OPTIONS), ValidateMode.ON_UPDATE))
        .doesNotThrowAnyException();
  }

  @Test
  void validateOrThrowRaisesUnprocessableEntity() {
    assertThatThrownBy(
            () ->
                service.validateOrThrow(
                    Map.of("scheduler_options", BI_MONTHLY_WITH_PERIOD), ValidateMode.ON_CREATE))
        .isInstanceOf(EntityValidationException.class)
        .satisfies(
            ex -> {
              var validationEx = (EntityValidationException) ex;
              assertThat(validationEx.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
              assertThat(validationEx.getBody().getTitle()).isEqualTo("Validation failed");
              assertThat(validationEx.getBody().getDetail())
                  .isEqualTo("1 validation error(s) for scheduled_report");
              assertThat(validationEx.getErrors())
                  .extracting(EntityValidationError::field)
                  .containsExactly("scheduler_options.period");
              assertThat(validationEx.getBody().getProperties())
                  .containsEntry("errors", List.copyOf(validationEx.getErrors()));
            });
  }
}
