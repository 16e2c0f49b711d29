/* (C)2026 */
package com.ammann.dip.resource;

import com.ammann.dip.config.DetectionDefaults;
import com.ammann.dip.dto.RequestValidatorDTO;
import com.ammann.dip.dto.TrendContextDTO;
import com.ammann.dip.dto.TrendRequestDTO;
import com.ammann.dip.exception.ValidationException;
import com.ammann.dip.properties.ApiProperties;
import com.ammann.dip.service.TrendContextService;
import com.ammann.dip.service.TrendContextService.HybridTrendContext;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/** REST resource describing the trend a series was in at a given index. */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Trend API", description = "Trend context around dips")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TrendResource {

    private static final Logger LOG = Logger.getLogger(TrendResource.class);

    @Inject TrendContextService trendService;

    @Inject DetectionDefaults defaults;

    @POST
    @Path(ApiProperties.Trend.BASE)
    @Operation(
            summary = "Trend context",
            description = "Combines moving-average and slope trend detection at the given index")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Trend computed",
                content = @Content(schema = @Schema(implementation = TrendContextDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid series, index or periods")
    })
    public Response trend(TrendRequestDTO request) {
        if (request == null) {
            throw ValidationException.invalidParameter("body", "null", "trend request");
        }
        double[] series = RequestValidatorDTO.toSeries(request.series(), defaults.getMaxSeriesLength());
        Integer index = request.index();
        if (index == null || index < 0 || index >= series.length) {
            throw ValidationException.invalidParameter("index", index, "index within the series");
        }
        List<Integer> periods =
                request.maPeriods() != null && !request.maPeriods().isEmpty()
                        ? request.maPeriods()
                        : TrendContextService.DEFAULT_MA_PERIODS;
        for (Integer period : periods) {
            if (period == null || period < 1) {
                throw ValidationException.invalidParameter("maPeriods", period, "positive integer");
            }
        }
        int lookback = request.lookback() != null ? request.lookback() : TrendContextService.DEFAULT_LOOKBACK;
        if (lookback < 1) {
            throw ValidationException.invalidParameter("lookback", lookback, "positive integer");
        }

        HybridTrendContext context = trendService.hybridTrend(series, index, periods, lookback);
        LOG.debugf("Trend at index %d of %d samples: %s", index, Integer.valueOf(series.length), context.finalTrend());
        return Response.ok(TrendContextDTO.from(context)).build();
    }
}
