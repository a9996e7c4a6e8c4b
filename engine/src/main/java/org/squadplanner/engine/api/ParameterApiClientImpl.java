package org.squadplanner.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.squadplanner.engine.api.dto.ParameterSetDto;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.GET;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrofit-based parameter source backed by the planner parameter API.
 */
public final class ParameterApiClientImpl implements ParameterSource {

    private static final Logger LOG = Logger.getLogger(ParameterApiClientImpl.class.getName());

    private final ParameterApiService api;
    private final String baseUrl;

    public ParameterApiClientImpl(String baseUrl) {
        this(baseUrl, null);
    }

    /**
     * @param token bearer token sent with every request, or null/empty for none
     */
    public ParameterApiClientImpl(String baseUrl, String token) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.baseUrl = normalizedUrl;

        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS);
        if (token != null && !token.isEmpty()) {
            clientBuilder.addInterceptor(new AuthInterceptor(token));
        }

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(clientBuilder.build())
                .build();

        this.api = retrofit.create(ParameterApiService.class);
    }

    @Override
    public ParameterSetDto fetchParameters() {
        return execute(api.getParameters(), "GET /v1/planner/parameters");
    }

    @Override
    public String describe() {
        return "parameter API at " + baseUrl;
    }

    /**
     * Execute a Retrofit call and return the result, or null on any failure.
     */
    private <T> T execute(Call<T> call, String description) {
        try {
            Response<T> response = call.execute();
            if (response.isSuccessful()) {
                return response.body();
            }
            LOG.warning(() -> String.format("[API] %s failed: %d %s",
                    description, response.code(), response.message()));
            return null;
        } catch (Exception e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
            return null;
        }
    }

    /**
     * Retrofit service interface for the parameter API.
     */
    interface ParameterApiService {
        @GET("v1/planner/parameters")
        Call<ParameterSetDto> getParameters();
    }
}
