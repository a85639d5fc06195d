package com.telemetrysentinel.core.io;

import com.telemetrysentinel.core.model.SensorSeries;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.DateAxis;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.time.FixedMillisecond;
import org.jfree.data.time.TimeSeries;
import org.jfree.data.time.TimeSeriesCollection;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.TimeZone;

/**
 * {@link PlotRenderer} backed by JFreeChart.
 *
 * <p>
 * Draws the sensor as a line over time and overlays the rows scored as
 * anomalous as red markers. Missing readings ({@code NaN}) are skipped.
 * Timestamps are treated as UTC. Each call builds its own chart, so the
 * renderer is thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class JFreeChartPlotRenderer implements PlotRenderer {

    public static final int DEFAULT_WIDTH = 1400;
    public static final int DEFAULT_HEIGHT = 700;

    private final int width;
    private final int height;

    public JFreeChartPlotRenderer() {
        this(DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    public JFreeChartPlotRenderer(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Image size must be positive, got: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    @Override
    public void render(SensorSeries series, String title, Path target) throws IOException {
        TimeSeries values = new TimeSeries(series.getSensor());
        TimeSeries anomalies = new TimeSeries("anomaly");
        for (int i = 0; i < series.size(); i++) {
            double value = series.valueAt(i);
            if (Double.isNaN(value)) {
                continue;
            }
            FixedMillisecond period = new FixedMillisecond(
                    series.getTimestamps().get(i).toInstant(ZoneOffset.UTC).toEpochMilli());
            values.addOrUpdate(period, value);
            if (series.isAnomalyAt(i)) {
                anomalies.addOrUpdate(period, value);
            }
        }

        TimeSeriesCollection dataset = new TimeSeriesCollection();
        dataset.addSeries(values);
        dataset.addSeries(anomalies);

        JFreeChart chart = ChartFactory.createTimeSeriesChart(
                title, "Time", "Sensor Value", dataset, true, false, false);

        XYPlot plot = chart.getXYPlot();
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
        renderer.setSeriesLinesVisible(0, true);
        renderer.setSeriesShapesVisible(0, false);
        renderer.setSeriesPaint(0, new Color(31, 119, 180));
        renderer.setSeriesLinesVisible(1, false);
        renderer.setSeriesShapesVisible(1, true);
        renderer.setSeriesPaint(1, Color.RED);
        plot.setRenderer(renderer);
        plot.setBackgroundPaint(Color.WHITE);
        if (plot.getDomainAxis() instanceof DateAxis axis) {
            axis.setTimeZone(TimeZone.getTimeZone("UTC"));
        }

        ChartUtils.saveChartAsPNG(target.toFile(), chart, width, height);
    }
}
