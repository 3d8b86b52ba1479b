package com.chicu.aimodelops.lifecycle.port;

import com.chicu.aimodelops.lifecycle.exception.DataUnavailableException;
import com.chicu.aimodelops.lifecycle.model.Dataset;

public interface TrainingDataLoader {

    Dataset loadTrainingData() throws DataUnavailableException;

    Dataset loadTestData() throws DataUnavailableException;
}
