/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

/**
 * Requirements of a pod to provision: the well known hardware and image attributes, and the provider specific
 * creation options.
 */
@Getter
@Setter
@Embeddable
public class PodSpec {

	/**
	 * Pattern of a creation option name.
	 */
	public static final Pattern OPTION_NAME = Pattern.compile("[a-z][a-z0-9_]*");

	/**
	 * Option names reserved by the creation request.
	 */
	public static final Set<String> RESERVED_OPTIONS = Set.of("client_id", "image", "disk", "label", "runtype",
			"onstart", "env", "args", "price");

	/**
	 * Docker image reference.
	 */
	@NotBlank
	private String image;

	/**
	 * Disk size, GB.
	 */
	private int diskSize = 50;

	/**
	 * GPU model name, such as "RTX 4090". When <code>null</code>, any GPU matches.
	 */
	private String gpuType;

	/**
	 * Amount of GPUs.
	 */
	private int numGpus = 1;

	/**
	 * Minimal memory per GPU, GB.
	 */
	private Double minGpuRam;

	/**
	 * Minimal amount of effective CPU cores.
	 */
	private Integer minCpuCores;

	/**
	 * Minimal system memory, GB.
	 */
	private Double minRam;

	/**
	 * Minimal host reliability, from 0 to 1.
	 */
	private Double minReliability;

	/**
	 * Maximal total price per hour, USD.
	 */
	private Double maxPricePerHour;

	private boolean useSsh = true;

	private boolean useDirect;

	/**
	 * Optional command executed on start.
	 */
	@Column(length = 4000)
	private String onStart;

	/**
	 * Environment variables of the container.
	 */
	@Column(length = 4000)
	@Convert(converter = StringMapConverter.class)
	private Map<String, String> env = new HashMap<>();

	/**
	 * Provider specific creation options, forwarded as is once validated.
	 */
	@Column(length = 4000)
	@Convert(converter = StringMapConverter.class)
	private Map<String, String> options = new HashMap<>();

}
