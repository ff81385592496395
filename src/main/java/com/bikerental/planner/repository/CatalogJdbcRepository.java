package com.bikerental.planner.repository;

import com.bikerental.planner.catalog.CatalogReader;
import com.bikerental.planner.domain.DomainModels.AvailabilityStatus;
import com.bikerental.planner.domain.DomainModels.BicycleRecord;
import com.bikerental.planner.domain.DomainModels.BicycleType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Repository
public class CatalogJdbcRepository implements CatalogReader {
    private final JdbcTemplate jdbcTemplate;

    public CatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Bicycles with an open rental (no return date) are reported as RENTED. A missing popularity
     * score is derived from the bicycle's share of the busiest bicycle's rental count.
     */
    @Override
    public List<BicycleRecord> snapshot() {
        List<CatalogRow> rows = jdbcTemplate.query(
                "SELECT b.id, b.brand, b.type, b.frame_size, b.price, b.condition_score, b.popularity_score, b.status, " +
                        "(SELECT COUNT(*) FROM rentals r WHERE r.bicycle_id = b.id) AS rental_count, " +
                        "(SELECT COUNT(*) FROM rentals r WHERE r.bicycle_id = b.id AND r.return_date IS NULL) AS open_rentals " +
                        "FROM bicycles b ORDER BY b.id",
                (rs, n) -> new CatalogRow(
                        rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        rs.getDouble(5), rs.getDouble(6), (Double) rs.getObject(7), rs.getString(8),
                        rs.getLong(9), rs.getLong(10)));

        long busiest = rows.stream().mapToLong(CatalogRow::rentalCount).max().orElse(0L);
        return rows.stream()
                .map(r -> new BicycleRecord(
                        r.id(),
                        r.brand(),
                        BicycleType.valueOf(r.type()),
                        r.frameSize(),
                        r.price(),
                        r.conditionScore(),
                        r.popularityScore() != null ? r.popularityScore()
                                : busiest == 0 ? 0.0 : (double) r.rentalCount() / busiest,
                        r.openRentals() > 0 ? AvailabilityStatus.RENTED : AvailabilityStatus.valueOf(r.status())))
                .toList();
    }

    public Set<Long> existingIds() {
        return new HashSet<>(jdbcTemplate.queryForList("SELECT id FROM bicycles", Long.class));
    }

    public void deleteAll() {
        jdbcTemplate.update("DELETE FROM rentals");
        jdbcTemplate.update("DELETE FROM bicycles");
    }

    public void upsertBicycles(List<BicycleRecord> bicycles, Set<Long> derivePopularity) {
        bicycles.forEach(b -> jdbcTemplate.update(
                "MERGE INTO bicycles(id, brand, type, frame_size, price, condition_score, popularity_score, status) KEY(id) VALUES (?,?,?,?,?,?,?,?)",
                b.id(), b.brand(), b.type().name(), b.frameSize(), b.price(), b.conditionScore(),
                derivePopularity.contains(b.id()) ? null : b.popularityScore(),
                b.status().name()));
    }

    public void insertRentals(List<RentalRow> rentals) {
        rentals.forEach(r -> jdbcTemplate.update(
                "INSERT INTO rentals(bicycle_id, rental_date, return_date, member_id) VALUES (?,?,?,?)",
                r.bicycleId(), r.rentalDate(), r.returnDate(), r.memberId()));
    }

    public record RentalRow(long bicycleId, String rentalDate, String returnDate, Long memberId) {}

    private record CatalogRow(long id, String brand, String type, String frameSize, double price,
                              double conditionScore, Double popularityScore, String status,
                              long rentalCount, long openRentals) {}
}
