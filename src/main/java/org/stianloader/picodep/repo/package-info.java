/**
 * Package storing the network access of picodep. Everything that leaves the local machine
 * goes through a {@link org.stianloader.picodep.repo.ResourceFetcher}, which makes it possible to
 * swap out the transport in tests or for environments that need authentication.
 */
package org.stianloader.picodep.repo;
