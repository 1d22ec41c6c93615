package space.ketterling.gridload.warehouse;

/**
 * Average zonal load for one wall-clock weekday and hour. {@code isoDayOfWeek}
 * runs from 1 (Monday) to 7 (Sunday).
 */
public record HourlyProfilePoint(String zoneName, int isoDayOfWeek, int hour, double avgLoadMw, long samples) {
}
