/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.provider;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.gpuproxy.pod.PodProperties;
import org.gpuproxy.pod.model.PodSpec;
import org.gpuproxy.pod.model.PodStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Vast.ai implementation of {@link GpuProvider}, over the REST API "v0".
 */
@Slf4j
@Component
public class VastProvider implements GpuProvider {

	/**
	 * Reported status considered as running. "loading" is a pod pulling its image.
	 */
	private static final List<String> RUNNING = List.of("running", "loading");

	@Autowired
	protected RestTemplate vastRestTemplate;

	@Autowired
	protected PodProperties properties;

	@Override
	public List<Offer> search(final PodSpec spec) throws ProviderException {
		final var query = newQuery(spec);
		log.debug("Search offers with query {}", query);
		final var response = call(HttpMethod.POST, "/bundles/", query);
		final var offers = new ArrayList<Offer>();
		for (final var node : response.path("offers")) {
			final var offer = new Offer(node.path("id").asText(), node.path("gpu_name").asText(),
					node.path("num_gpus").asInt(), node.path("dph_total").asDouble());
			if (matchGpu(spec.getGpuType(), offer.getGpuName())) {
				offers.add(offer);
			}
		}
		log.debug("Found {} offers", offers.size());
		return offers;
	}

	/**
	 * The API does not always filter the GPU name, post filter the result.
	 */
	private boolean matchGpu(final String gpuType, final String gpuName) {
		return StringUtils.isBlank(gpuType)
				|| StringUtils.containsIgnoreCase(gpuName.replace('_', ' '), gpuType.replace('_', ' '));
	}

	/**
	 * Build the search query of the given requirements. Only rentable and verified offers are returned, ordered by
	 * score.
	 */
	protected Map<String, Object> newQuery(final PodSpec spec) {
		final var query = new LinkedHashMap<String, Object>();
		query.put("verified", Map.of("eq", true));
		query.put("rentable", Map.of("eq", true));
		query.put("rented", Map.of("eq", false));
		query.put("type", "on-demand");
		query.put("order", List.of(List.of("score", "desc")));
		if (StringUtils.isNotBlank(spec.getGpuType())) {
			query.put("gpu_name", Map.of("eq", spec.getGpuType().trim().replace(' ', '_')));
		}
		query.put("num_gpus", Map.of("eq", spec.getNumGpus()));
		query.put("disk_space", Map.of("gte", spec.getDiskSize()));
		putMin(query, "gpu_ram", toMb(spec.getMinGpuRam()));
		putMin(query, "cpu_ram", toMb(spec.getMinRam()));
		putMin(query, "cpu_cores_effective", spec.getMinCpuCores());
		putMin(query, "reliability2", spec.getMinReliability());
		if (spec.getMaxPricePerHour() != null) {
			query.put("dph_total", Map.of("lte", spec.getMaxPricePerHour()));
		}
		return query;
	}

	private void putMin(final Map<String, Object> query, final String field, final Number value) {
		if (value != null) {
			query.put(field, Map.of("gte", value));
		}
	}

	private Double toMb(final Double gb) {
		return gb == null ? null : gb * 1000;
	}

	@Override
	public String provision(final String offer, final String label, final PodSpec spec) throws ProviderException {
		final var request = new LinkedHashMap<String, Object>();
		request.put("client_id", "me");
		request.put("image", spec.getImage());
		request.put("disk", spec.getDiskSize());
		request.put("label", label);
		request.put("runtype", toRunType(spec));
		if (StringUtils.isNotBlank(spec.getOnStart())) {
			request.put("onstart", spec.getOnStart());
		}
		if (!spec.getEnv().isEmpty()) {
			request.put("env", new HashMap<>(spec.getEnv()));
		}

		// Extension options are validated on the schedule side and cannot shadow the known fields
		spec.getOptions().forEach(request::putIfAbsent);
		log.info("Create instance from offer {} with image {}, label {}", offer, spec.getImage(), label);
		final var response = call(HttpMethod.PUT, "/asks/" + offer + "/", request);
		final var contract = response.path("new_contract");
		if (!response.path("success").asBoolean(true) || contract.isMissingNode() || contract.isNull()) {
			throw new ProviderException("Instance creation from offer " + offer + " refused: " + response);
		}
		return contract.asText();
	}

	/**
	 * Return the launch mode: SSH (proxied or direct), or the image entry point.
	 */
	protected String toRunType(final PodSpec spec) {
		if (spec.isUseSsh()) {
			return spec.isUseDirect() ? "ssh_direc ssh_proxy" : "ssh_proxy";
		}
		return "args";
	}

	@Override
	public void release(final String instance) throws ProviderException {
		final var path = "/instances/" + instance + "/";
		try {
			if (properties.getProvider().getReleaseMode() == ReleaseMode.DESTROY) {
				log.info("Destroy instance {}", instance);
				call(HttpMethod.DELETE, path, null);
			} else {
				log.info("Stop instance {}", instance);
				call(HttpMethod.PUT, path, Map.of("state", "stopped"));
			}
		} catch (final ProviderException e) {
			if (e.getCause() instanceof HttpClientErrorException.NotFound) {
				throw new InstanceNotFoundException(instance, e.getCause());
			}
			throw e;
		}
	}

	@Override
	public Map<String, PodStatus> listStatus() throws ProviderException {
		final var response = call(HttpMethod.GET, "/instances/?owner=me", null);
		if (!response.path("instances").isArray()) {
			// An absence can only be concluded from a complete listing
			throw new ProviderException("Unexpected instance listing " + response);
		}
		final var result = new HashMap<String, PodStatus>();
		for (final var node : response.path("instances")) {
			final var status = StringUtils.lowerCase(node.path("actual_status").asText(null));
			final var running = status != null && RUNNING.contains(status);
			result.put(node.path("id").asText(), running ? PodStatus.RUNNING : PodStatus.STOPPED);
		}
		return result;
	}

	/**
	 * Execute an authenticated JSON call.
	 */
	private JsonNode call(final HttpMethod method, final String path, final Object body) throws ProviderException {
		final var headers = new HttpHeaders();
		headers.setContentType(MediaType.APPLICATION_JSON);
		headers.setAccept(List.of(MediaType.APPLICATION_JSON));
		if (StringUtils.isNotBlank(properties.getProvider().getApiKey())) {
			headers.setBearerAuth(properties.getProvider().getApiKey());
		}
		final var url = StringUtils.removeEnd(properties.getProvider().getUrl(), "/") + path;
		try {
			final var response = vastRestTemplate.exchange(url, method, new HttpEntity<>(body, headers), JsonNode.class);
			return response.getBody() == null ? MissingNode.getInstance() : response.getBody();
		} catch (final RestClientException e) {
			throw new ProviderException(method + " " + path + " failed: " + e.getMessage(), e);
		}
	}
}
