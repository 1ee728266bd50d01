package io.b2mash.b2b.taskengine.assignment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.taskengine.exception.InvalidClientReferenceException;
import io.b2mash.b2b.taskengine.exception.InvalidStateException;
import io.b2mash.b2b.taskengine.exception.UnauthorizedClientException;
import io.b2mash.b2b.taskengine.recurrence.RecurrencePattern;
import io.b2mash.b2b.taskengine.recurringtask.RecurringTask;
import io.b2mash.b2b.taskengine.testutil.TestEntities;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AssignmentMapperTest {

  private static final Viewer ADMIN = new Viewer("admin-1", ViewerRole.ADMIN);
  private static final Viewer MANAGER = new Viewer("mgr-1", ViewerRole.MANAGER);
  private static final Viewer E1 = new Viewer("E1", ViewerRole.EMPLOYEE);
  private static final Viewer E2 = new Viewer("E2", ViewerRole.EMPLOYEE);
  private static final Viewer E3 = new Viewer("E3", ViewerRole.EMPLOYEE);

  private final AssignmentMapper mapper = new AssignmentMapper();

  private RecurringTask mappedTask() {
    return TestEntities.mappedTask(
        RecurrencePattern.MONTHLY,
        Set.of("C1", "C2", "C3"),
        List.of(
            new TeamMemberMapping("E1", "Asha", Set.of("C1", "C3")),
            new TeamMemberMapping("E2", "Ravi", Set.of("C2"))));
  }

  @Test
  void visibleClientIds_unmappedTask_fallsBackToAllAssigned() {
    var task =
        TestEntities.task(
            RecurrencePattern.QUARTERLY, LocalDate.of(2026, 4, 1), Set.of("C1", "C2"));

    assertThat(mapper.visibleClientIds(task, E3)).containsExactlyInAnyOrder("C1", "C2");
    assertThat(mapper.isTaskVisible(task, E3)).isTrue();
  }

  @Test
  void visibleClientIds_mappedEmployees_seeOnlyTheirClients() {
    var task = mappedTask();

    assertThat(mapper.visibleClientIds(task, E1)).containsExactlyInAnyOrder("C1", "C3");
    assertThat(mapper.visibleClientIds(task, E2)).containsExactly("C2");
  }

  @Test
  void visibleClientIds_privilegedViewers_seeAllAssigned() {
    var task = mappedTask();

    assertThat(mapper.visibleClientIds(task, ADMIN)).containsExactlyInAnyOrder("C1", "C2", "C3");
    assertThat(mapper.visibleClientIds(task, MANAGER)).containsExactlyInAnyOrder("C1", "C2", "C3");
  }

  @Test
  void visibleClientIds_unmappedEmployeeOnMappedTask_seesNothing() {
    var task = mappedTask();

    assertThat(mapper.visibleClientIds(task, E3)).isEmpty();
    assertThat(mapper.isTaskVisible(task, E3)).isFalse();
  }

  @Test
  void visibleClientIds_disjointMappings_partitionAssignedClients() {
    var task = mappedTask();
    var union = new HashSet<String>();
    union.addAll(mapper.visibleClientIds(task, E1));
    union.addAll(mapper.visibleClientIds(task, E2));

    assertThat(union).isEqualTo(task.getAssignedClientIds());
    assertThat(mapper.visibleClientIds(task, E1))
        .doesNotContainAnyElementsOf(mapper.visibleClientIds(task, E2));
  }

  @Test
  void isTaskVisible_adminOnTaskWithoutClients_isTrue() {
    var task = TestEntities.task(RecurrencePattern.MONTHLY, LocalDate.of(2026, 4, 1), Set.of());

    assertThat(mapper.isTaskVisible(task, ADMIN)).isTrue();
  }

  @Test
  void requireVisibleClient_outsideVisibleSet_throws() {
    var task = mappedTask();

    mapper.requireVisibleClient(task, E1, "C1");
    assertThatThrownBy(() -> mapper.requireVisibleClient(task, E1, "C2"))
        .isInstanceOf(UnauthorizedClientException.class);
  }

  @Test
  void addOrUpdateMapping_existingEmployee_replacesInPlace() {
    var task = mappedTask();

    mapper.addOrUpdateMapping(task, "E1", "Asha K", List.of("C2"));

    assertThat(task.getTeamMemberMappings())
        .extracting(TeamMemberMapping::employeeId)
        .containsExactly("E1", "E2");
    assertThat(task.getTeamMemberMappings().get(0).clientIds()).containsExactly("C2");
    assertThat(task.getTeamMemberMappings().get(0).employeeName()).isEqualTo("Asha K");
  }

  @Test
  void addOrUpdateMapping_newEmployee_appendsAndAllowsSharedClients() {
    var task = mappedTask();

    mapper.addOrUpdateMapping(task, "E3", "Meera", List.of("C1"));

    assertThat(task.getTeamMemberMappings())
        .extracting(TeamMemberMapping::employeeId)
        .containsExactly("E1", "E2", "E3");
    assertThat(mapper.visibleClientIds(task, E3)).containsExactly("C1");
    assertThat(mapper.visibleClientIds(task, E1)).contains("C1");
  }

  @Test
  void addOrUpdateMapping_unassignedClient_throwsAndLeavesMappingsUnchanged() {
    var task = mappedTask();

    assertThatThrownBy(() -> mapper.addOrUpdateMapping(task, "E1", "Asha", List.of("C1", "C9")))
        .isInstanceOf(InvalidClientReferenceException.class)
        .satisfies(
            ex ->
                assertThat(((InvalidClientReferenceException) ex).getUnknownClientIds())
                    .containsExactly("C9"));
    assertThat(mapper.visibleClientIds(task, E1)).containsExactlyInAnyOrder("C1", "C3");
  }

  @Test
  void removeMapping_isIdempotent() {
    var task = mappedTask();

    assertThat(mapper.removeMapping(task, "E2")).isTrue();
    assertThat(mapper.removeMapping(task, "E2")).isFalse();
    assertThat(task.getTeamMemberMappings())
        .extracting(TeamMemberMapping::employeeId)
        .containsExactly("E1");
  }

  @Test
  void replaceMappings_duplicateEmployee_throws() {
    var task = mappedTask();
    var duplicated =
        List.of(
            new TeamMemberMapping("E1", "Asha", Set.of("C1")),
            new TeamMemberMapping("E1", "Asha", Set.of("C2")));

    assertThatThrownBy(() -> mapper.replaceMappings(task, duplicated))
        .isInstanceOf(InvalidStateException.class);
    assertThat(task.getTeamMemberMappings()).hasSize(2);
  }

  @Test
  void replaceMappings_emptyList_restoresUnmappedFallback() {
    var task = mappedTask();

    mapper.replaceMappings(task, List.of());

    assertThat(mapper.visibleClientIds(task, E3)).containsExactlyInAnyOrder("C1", "C2", "C3");
  }

  @Test
  void validateAll_shrunkAssignedSet_rejectsStaleMapping() {
    var task = mappedTask();

    assertThatThrownBy(() -> mapper.validateAll(Set.of("C1", "C2"), task.getTeamMemberMappings()))
        .isInstanceOf(InvalidClientReferenceException.class);
  }
}
