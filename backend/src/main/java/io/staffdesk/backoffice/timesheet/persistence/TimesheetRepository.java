package io.staffdesk.backoffice.timesheet.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimesheetRepository extends JpaRepository<Timesheet, UUID> {

  /** Timesheets of a jobseeker whose whole week lies within {@code [weekStart, weekEnd]}. */
  @Query(
      """
      SELECT t FROM Timesheet t
      WHERE t.jobseekerUserId = :jobseekerUserId
        AND t.weekStartDate >= :weekStart
        AND t.weekEndDate <= :weekEnd
      ORDER BY t.weekStartDate DESC
      """)
  List<Timesheet> findByJobseekerAndWeek(
      @Param("jobseekerUserId") UUID jobseekerUserId,
      @Param("weekStart") LocalDate weekStart,
      @Param("weekEnd") LocalDate weekEnd);

  boolean existsByInvoiceNumber(String invoiceNumber);

  Optional<Timesheet> findByJobseekerProfileIdAndPositionIdAndWeekStartDate(
      UUID jobseekerProfileId, UUID positionId, LocalDate weekStartDate);

  /**
   * Nullable-parameter filter query: each {@code (:param IS NULL OR ...)} clause is skipped when
   * its parameter is null.
   */
  @Query(
      """
      SELECT t FROM Timesheet t
      WHERE (:jobseekerProfileId IS NULL OR t.jobseekerProfileId = :jobseekerProfileId)
        AND (:positionId IS NULL OR t.positionId = :positionId)
        AND (CAST(:weekStartDate AS date) IS NULL OR t.weekStartDate = :weekStartDate)
        AND (CAST(:weekEndDate AS date) IS NULL OR t.weekEndDate = :weekEndDate)
        AND (:emailSent IS NULL OR t.emailSent = :emailSent)
        AND (CAST(:rangeFrom AS date) IS NULL OR t.weekStartDate >= :rangeFrom)
        AND (CAST(:rangeTo AS date) IS NULL OR t.weekEndDate <= :rangeTo)
      """)
  Page<Timesheet> findByFilter(
      @Param("jobseekerProfileId") UUID jobseekerProfileId,
      @Param("positionId") UUID positionId,
      @Param("weekStartDate") LocalDate weekStartDate,
      @Param("weekEndDate") LocalDate weekEndDate,
      @Param("emailSent") Boolean emailSent,
      @Param("rangeFrom") LocalDate rangeFrom,
      @Param("rangeTo") LocalDate rangeTo,
      Pageable pageable);
}
